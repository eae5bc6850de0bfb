package com.finfact.pipeline.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private String dictionaryLocation = "classpath:taxonomy/financial_dictionary.json";
    private int workerPoolSize = 4;
    private String runReportPath = "data/run-reports";
    private long manualResolutionLockWaitMs = 5_000;
    private List<Engine> engines = new ArrayList<>();
    private Grid grid = new Grid();
    private Matching matching = new Matching();
    private Candidates candidates = new Candidates();
    private Consensus consensus = new Consensus();
    private Consistency consistency = new Consistency();

    public String getDictionaryLocation() {
        return dictionaryLocation;
    }

    public void setDictionaryLocation(String dictionaryLocation) {
        this.dictionaryLocation = dictionaryLocation;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public String getRunReportPath() {
        return runReportPath;
    }

    public void setRunReportPath(String runReportPath) {
        this.runReportPath = runReportPath;
    }

    public long getManualResolutionLockWaitMs() {
        return manualResolutionLockWaitMs;
    }

    public void setManualResolutionLockWaitMs(long manualResolutionLockWaitMs) {
        this.manualResolutionLockWaitMs = manualResolutionLockWaitMs;
    }

    public List<Engine> getEngines() {
        return engines;
    }

    public void setEngines(List<Engine> engines) {
        this.engines = engines;
    }

    public Grid getGrid() {
        return grid;
    }

    public void setGrid(Grid grid) {
        this.grid = grid;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Candidates getCandidates() {
        return candidates;
    }

    public void setCandidates(Candidates candidates) {
        this.candidates = candidates;
    }

    public Consensus getConsensus() {
        return consensus;
    }

    public void setConsensus(Consensus consensus) {
        this.consensus = consensus;
    }

    public Consistency getConsistency() {
        return consistency;
    }

    public void setConsistency(Consistency consistency) {
        this.consistency = consistency;
    }

    /**
     * One extraction engine. {@code command} may reference {@code {input}} and {@code {output}};
     * a blank command means the engine's artifacts are produced elsewhere and only discovered.
     */
    public static class Engine {

        private String name;
        private String command;
        private String outputDir;
        private String fallbackDir;
        private long timeoutSeconds = 600;
        private int maxAttempts = 2;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public String getFallbackDir() {
            return fallbackDir;
        }

        public void setFallbackDir(String fallbackDir) {
            this.fallbackDir = fallbackDir;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Grid {

        private int columnOffsetTolerance = 4;
        private int maxHeaderRows = 3;

        public int getColumnOffsetTolerance() {
            return columnOffsetTolerance;
        }

        public void setColumnOffsetTolerance(int columnOffsetTolerance) {
            this.columnOffsetTolerance = columnOffsetTolerance;
        }

        public int getMaxHeaderRows() {
            return maxHeaderRows;
        }

        public void setMaxHeaderRows(int maxHeaderRows) {
            this.maxHeaderRows = maxHeaderRows;
        }
    }

    public static class Matching {

        private int shortLabelMaxLength = 2;
        private int maxAffixResidue = 6;

        public int getShortLabelMaxLength() {
            return shortLabelMaxLength;
        }

        public void setShortLabelMaxLength(int shortLabelMaxLength) {
            this.shortLabelMaxLength = shortLabelMaxLength;
        }

        public int getMaxAffixResidue() {
            return maxAffixResidue;
        }

        public void setMaxAffixResidue(int maxAffixResidue) {
            this.maxAffixResidue = maxAffixResidue;
        }
    }

    public static class Candidates {

        private String defaultCurrency = "CNY";
        private String defaultUnit = "1";
        private String defaultScope = "consolidated";
        private int fiscalYearEndMonth = 12;
        private int fiscalYearEndDay = 31;
        private int minDistinctMetricsPerTable = 2;
        private double unmatchedQuality = 0.3;
        private double parseFailurePenalty = 0.5;
        private double unresolvedPeriodPenalty = 0.2;
        private double positionalColumnPenalty = 0.1;

        public String getDefaultCurrency() {
            return defaultCurrency;
        }

        public void setDefaultCurrency(String defaultCurrency) {
            this.defaultCurrency = defaultCurrency;
        }

        public String getDefaultUnit() {
            return defaultUnit;
        }

        public void setDefaultUnit(String defaultUnit) {
            this.defaultUnit = defaultUnit;
        }

        public String getDefaultScope() {
            return defaultScope;
        }

        public void setDefaultScope(String defaultScope) {
            this.defaultScope = defaultScope;
        }

        public int getFiscalYearEndMonth() {
            return fiscalYearEndMonth;
        }

        public void setFiscalYearEndMonth(int fiscalYearEndMonth) {
            this.fiscalYearEndMonth = fiscalYearEndMonth;
        }

        public int getFiscalYearEndDay() {
            return fiscalYearEndDay;
        }

        public void setFiscalYearEndDay(int fiscalYearEndDay) {
            this.fiscalYearEndDay = fiscalYearEndDay;
        }

        public int getMinDistinctMetricsPerTable() {
            return minDistinctMetricsPerTable;
        }

        public void setMinDistinctMetricsPerTable(int minDistinctMetricsPerTable) {
            this.minDistinctMetricsPerTable = minDistinctMetricsPerTable;
        }

        public double getUnmatchedQuality() {
            return unmatchedQuality;
        }

        public void setUnmatchedQuality(double unmatchedQuality) {
            this.unmatchedQuality = unmatchedQuality;
        }

        public double getParseFailurePenalty() {
            return parseFailurePenalty;
        }

        public void setParseFailurePenalty(double parseFailurePenalty) {
            this.parseFailurePenalty = parseFailurePenalty;
        }

        public double getUnresolvedPeriodPenalty() {
            return unresolvedPeriodPenalty;
        }

        public void setUnresolvedPeriodPenalty(double unresolvedPeriodPenalty) {
            this.unresolvedPeriodPenalty = unresolvedPeriodPenalty;
        }

        public double getPositionalColumnPenalty() {
            return positionalColumnPenalty;
        }

        public void setPositionalColumnPenalty(double positionalColumnPenalty) {
            this.positionalColumnPenalty = positionalColumnPenalty;
        }
    }

    public static class Consensus {

        private double relativeTolerance = 0.0005;
        private double absoluteTolerance = 0.01;
        private int minAgreeingEngines = 2;
        private List<String> currentPeriodLabels = new ArrayList<>(List.of(
            "本期", "本年", "本期金额", "本年金额", "本期发生额", "本年发生额", "期末", "期末余额", "年末", "年末余额", "current"
        ));
        private List<String> priorPeriodLabels = new ArrayList<>(List.of(
            "上期", "上年", "上期金额", "上年金额", "上期发生额", "上年发生额", "期初", "期初余额", "年初", "年初余额", "prior"
        ));

        public double getRelativeTolerance() {
            return relativeTolerance;
        }

        public void setRelativeTolerance(double relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
        }

        public double getAbsoluteTolerance() {
            return absoluteTolerance;
        }

        public void setAbsoluteTolerance(double absoluteTolerance) {
            this.absoluteTolerance = absoluteTolerance;
        }

        public int getMinAgreeingEngines() {
            return minAgreeingEngines;
        }

        public void setMinAgreeingEngines(int minAgreeingEngines) {
            this.minAgreeingEngines = minAgreeingEngines;
        }

        public List<String> getCurrentPeriodLabels() {
            return currentPeriodLabels;
        }

        public void setCurrentPeriodLabels(List<String> currentPeriodLabels) {
            this.currentPeriodLabels = currentPeriodLabels;
        }

        public List<String> getPriorPeriodLabels() {
            return priorPeriodLabels;
        }

        public void setPriorPeriodLabels(List<String> priorPeriodLabels) {
            this.priorPeriodLabels = priorPeriodLabels;
        }
    }

    public static class Consistency {

        private double absoluteTolerance = 1.0;
        private double relativeTolerance = 0.000001;

        public double getAbsoluteTolerance() {
            return absoluteTolerance;
        }

        public void setAbsoluteTolerance(double absoluteTolerance) {
            this.absoluteTolerance = absoluteTolerance;
        }

        public double getRelativeTolerance() {
            return relativeTolerance;
        }

        public void setRelativeTolerance(double relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
        }
    }
}
