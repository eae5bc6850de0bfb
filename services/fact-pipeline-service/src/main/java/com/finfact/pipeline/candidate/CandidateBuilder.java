package com.finfact.pipeline.candidate;

import com.finfact.pipeline.artifact.RawTableCandidate;
import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.support.NumericValueParser;
import com.finfact.pipeline.support.TextDates;
import com.finfact.pipeline.taxonomy.MatchMethod;
import com.finfact.pipeline.taxonomy.MatchRequest;
import com.finfact.pipeline.taxonomy.MatchResult;
import com.finfact.pipeline.taxonomy.MetricDictionary;
import com.finfact.pipeline.taxonomy.MetricMatcher;
import com.finfact.pipeline.taxonomy.StatementType;
import com.finfact.pipeline.taxonomy.StatementTypeDetector;
import com.finfact.pipeline.taxonomy.ValueNature;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the matched cells of one raw table into typed {@link FactCandidate}s.
 *
 * <p>A table that matches fewer distinct metrics than
 * {@code pipeline.candidates.min-distinct-metrics-per-table} is treated as noise (narrative
 * text, a note breakdown) and writes nothing.</p>
 */
@Component
public class CandidateBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateBuilder.class);
    private static final double AFFIX_QUALITY = 0.9;

    private final MetricMatcher metricMatcher;
    private final StatementTypeDetector statementTypeDetector;
    private final PeriodResolver periodResolver;
    private final PipelineProperties.Candidates settings;

    public CandidateBuilder(
        MetricMatcher metricMatcher,
        StatementTypeDetector statementTypeDetector,
        PeriodResolver periodResolver,
        PipelineProperties properties
    ) {
        this.metricMatcher = metricMatcher;
        this.statementTypeDetector = statementTypeDetector;
        this.periodResolver = periodResolver;
        this.settings = properties.getCandidates();
    }

    public TableCandidates build(MetricDictionary dictionary, RawTableCandidate table, BuildContext context) {
        LogicalGrid grid = table.grid();
        List<List<String>> rows = grid.dataRows();
        if (grid.columnCount() < 2 || rows.isEmpty()) {
            return TableCandidates.rejected(0, 0, 0, null);
        }

        List<String> rowLabels = rows.stream().map(row -> row.get(0)).filter(label -> !label.isBlank()).toList();
        StatementType tableType = statementTypeDetector.fromText(dictionary, table.title())
            .or(() -> statementTypeDetector.fromText(dictionary, table.context()))
            .or(() -> statementTypeDetector.dominantType(dictionary, rowLabels))
            .orElse(null);
        String ruleCode = statementTypeDetector.ruleCode(table.title())
            .or(() -> statementTypeDetector.ruleCode(table.context()))
            .orElse(null);

        String surroundings = table.title() + "\n" + table.context() + "\n" + String.join(" ", grid.columnLabels());
        UnitContext units = UnitContext.detect(surroundings, settings.getDefaultCurrency(), settings.getDefaultUnit());
        ConsolidationScope tableScope = ConsolidationScope.fromText(table.title())
            .or(() -> ConsolidationScope.fromText(table.context()))
            .or(() -> ConsolidationScope.fromCode(settings.getDefaultScope()))
            .orElse(ConsolidationScope.CONSOLIDATED);
        Integer fiscalYear = context.fiscalYear() != null ? context.fiscalYear() : inferFiscalYear(table);

        List<FactCandidate> candidates = new ArrayList<>();
        Set<String> distinctMetrics = new HashSet<>();
        int unmatchedRows = 0;
        int labelledRows = 0;
        for (List<String> row : rows) {
            String label = row.get(0);
            if (label.isBlank()) {
                continue;
            }
            labelledRows++;
            MatchResult match = metricMatcher.match(dictionary, new MatchRequest(label, tableType, ruleCode));
            if (match.isMatched()) {
                distinctMetrics.add(match.metricCode());
            } else {
                unmatchedRows++;
            }
            FactType factType = factType(match);

            for (int c = 1; c < grid.columnCount(); c++) {
                String columnLabel = grid.columnLabel(c);
                String rawValue = row.get(c);
                if (rawValue.isBlank() || isNoteColumn(columnLabel)) {
                    continue;
                }
                candidates.add(candidate(match, factType, label, rawValue, columnLabel, units, tableScope, fiscalYear, table, context));
            }
        }

        if (distinctMetrics.size() < settings.getMinDistinctMetricsPerTable()) {
            LOGGER.debug("Rejected table on page {} ({}): {} distinct metrics",
                table.pageNumber(), table.engine(), distinctMetrics.size());
            return TableCandidates.rejected(distinctMetrics.size(), unmatchedRows, labelledRows, tableType);
        }
        return new TableCandidates(candidates, distinctMetrics.size(), true, unmatchedRows, labelledRows, tableType);
    }

    private FactCandidate candidate(
        MatchResult match,
        FactType factType,
        String label,
        String rawValue,
        String columnLabel,
        UnitContext units,
        ConsolidationScope tableScope,
        Integer fiscalYear,
        RawTableCandidate table,
        BuildContext context
    ) {
        Optional<BigDecimal> parsed = NumericValueParser.parse(rawValue);
        BigDecimal value = parsed.map(v -> match.isMatched() ? match.metric().signConvention().apply(v) : v).orElse(null);
        String unit = NumericValueParser.isPercent(rawValue) ? "percent" : units.unit();
        ConsolidationScope scope = ConsolidationScope.fromText(columnLabel).orElse(tableScope);
        PeriodResolver.Resolution period = periodResolver.resolve(columnLabel, factType, fiscalYear);

        double quality = baseQuality(match.method());
        if (value == null) {
            quality -= settings.getParseFailurePenalty();
        }
        if (!period.period().isResolved()) {
            quality -= settings.getUnresolvedPeriodPenalty();
        } else if (period.positional()) {
            quality -= settings.getPositionalColumnPenalty();
        }

        return new FactCandidate(
            match.metricCode(),
            match.isMatched(),
            match.statementType(),
            label,
            rawValue,
            value,
            unit,
            units.currency(),
            scope,
            period.period(),
            table.engine(),
            context.versionId(),
            table.pageNumber(),
            columnLabel,
            Math.max(0.0, Math.min(1.0, quality))
        );
    }

    private double baseQuality(MatchMethod method) {
        return switch (method) {
            case EXACT -> 1.0;
            case AFFIX -> AFFIX_QUALITY;
            case NONE -> settings.getUnmatchedQuality();
        };
    }

    private static FactType factType(MatchResult match) {
        if (match.isMatched() && match.metric().valueNature() == ValueNature.STOCK) {
            return FactType.STOCK;
        }
        if (match.isMatched() && match.metric().valueNature() == ValueNature.FLOW) {
            return FactType.FLOW;
        }
        return match.statementType() == StatementType.BALANCE ? FactType.STOCK : FactType.FLOW;
    }

    private static boolean isNoteColumn(String columnLabel) {
        String lowered = columnLabel.toLowerCase(Locale.ROOT);
        return lowered.contains("附注") || lowered.equals("note") || lowered.equals("notes");
    }

    private static Integer inferFiscalYear(RawTableCandidate table) {
        Integer latest = null;
        for (String label : table.grid().columnLabels()) {
            Optional<Integer> year = TextDates.firstYear(label);
            if (year.isPresent() && (latest == null || year.get() > latest)) {
                latest = year.get();
            }
        }
        return latest != null ? latest : TextDates.firstYear(table.title()).orElse(null);
    }
}
