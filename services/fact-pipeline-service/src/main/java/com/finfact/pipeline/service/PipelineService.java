package com.finfact.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.consensus.AgreementStats;
import com.finfact.pipeline.consistency.ConsistencyCheckResult;
import com.finfact.pipeline.domain.ExtractionFailureEntity;
import com.finfact.pipeline.domain.PipelineRunEntity;
import com.finfact.pipeline.domain.ReportVersionEntity;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.repository.ExtractionFailureRepository;
import com.finfact.pipeline.repository.PipelineRunRepository;
import com.finfact.pipeline.repository.ReportVersionRepository;
import com.finfact.pipeline.repository.ResolvedFactRepository;
import com.finfact.pipeline.taxonomy.MetricDictionary;
import com.finfact.pipeline.taxonomy.MetricDictionaryLoader;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * One pipeline run for one report: extraction by every engine, automatic resolution,
 * consistency checks, and the run report.
 *
 * <p>Fatal conditions are a dictionary that cannot be loaded and a run in which no engine
 * left any artifact; both mark the run {@code FAILED} and propagate. Everything else is recorded and
 * the run completes, {@code PARTIAL_SUCCESS} when some engine failed.</p>
 */
@Service
public class PipelineService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

    private final MetricDictionaryLoader dictionaryLoader;
    private final ExtractionJobService extractionJobService;
    private final ResolutionService resolutionService;
    private final ConsistencyService consistencyService;
    private final PipelineRunRepository pipelineRunRepository;
    private final ExtractionFailureRepository extractionFailureRepository;
    private final ReportVersionRepository reportVersionRepository;
    private final ResolvedFactRepository resolvedFactRepository;
    private final RunReportStorage runReportStorage;
    private final ObjectMapper objectMapper;

    public PipelineService(
        MetricDictionaryLoader dictionaryLoader,
        ExtractionJobService extractionJobService,
        ResolutionService resolutionService,
        ConsistencyService consistencyService,
        PipelineRunRepository pipelineRunRepository,
        ExtractionFailureRepository extractionFailureRepository,
        ReportVersionRepository reportVersionRepository,
        ResolvedFactRepository resolvedFactRepository,
        RunReportStorage runReportStorage,
        ObjectMapper objectMapper
    ) {
        this.dictionaryLoader = dictionaryLoader;
        this.extractionJobService = extractionJobService;
        this.resolutionService = resolutionService;
        this.consistencyService = consistencyService;
        this.pipelineRunRepository = pipelineRunRepository;
        this.extractionFailureRepository = extractionFailureRepository;
        this.reportVersionRepository = reportVersionRepository;
        this.resolvedFactRepository = resolvedFactRepository;
        this.runReportStorage = runReportStorage;
        this.objectMapper = objectMapper;
    }

    public PipelineRunEntity run(PipelineRunCommand command) {
        if (command.reportId() == null || command.reportId().isBlank()) {
            throw new IllegalArgumentException("reportId must not be blank");
        }
        List<PipelineProperties.Engine> engines = extractionJobService.selectEngines(command.engines());
        if (engines.isEmpty()) {
            throw new IllegalArgumentException("No extraction engines configured");
        }

        PipelineRunEntity run = pipelineRunRepository.save(PipelineRunEntity.startNew(command.reportId(), engines.size()));
        MDC.put("reportId", command.reportId());
        MDC.put("runId", run.getRunId().toString());
        try {
            MetricDictionary dictionary = dictionaryLoader.load();

            List<EngineOutcome> outcomes = extractionJobService.extractAll(run.getRunId(), command, engines, dictionary);
            for (EngineOutcome outcome : outcomes) {
                if (outcome.succeeded()) {
                    run.incrementEnginesSucceeded();
                } else {
                    run.incrementEnginesFailed();
                }
                run.addCandidatesWritten(outcome.candidatesWritten());
                run.addTablesRejected(outcome.tablesRejected());
            }
            if (outcomes.stream().noneMatch(EngineOutcome::producedArtifacts)) {
                throw new PipelineException("No engine produced usable artifacts for report " + command.reportId());
            }

            ResolutionOutcome resolution = resolutionService.resolve(command.reportId(), command.overrideVerified());
            run.setFactsWritten(resolution.write().written());
            List<ConsistencyCheckResult> checks = consistencyService.check(command.reportId());

            String reportJson = toJson(buildReport(run, dictionary, outcomes, checks));
            run.attachReport(reportJson);
            String location = runReportStorage.store(command.reportId(), run.getRunId(), reportJson);
            LOGGER.info("Run {} for report {} stored its report at {}", run.getRunId(), command.reportId(), location);

            run.complete();
            pipelineRunRepository.save(run);
            return run;
        } catch (RuntimeException fatal) {
            LOGGER.error("Run {} for report {} failed: {}", run.getRunId(), command.reportId(), fatal.getMessage());
            run.fail(truncate(fatal.getMessage(), 400));
            pipelineRunRepository.save(run);
            throw fatal;
        } finally {
            MDC.remove("runId");
            MDC.remove("reportId");
        }
    }

    public Optional<PipelineRunEntity> getRun(UUID runId) {
        return pipelineRunRepository.findById(runId);
    }

    public List<ExtractionFailureEntity> getRunFailures(UUID runId) {
        return extractionFailureRepository.findTop20ByRunIdOrderByCreatedAtDesc(runId);
    }

    public List<ReportVersionEntity> getRunVersions(UUID runId) {
        return reportVersionRepository.findByRunIdOrderByEngine(runId);
    }

    private RunReport buildReport(
        PipelineRunEntity run,
        MetricDictionary dictionary,
        List<EngineOutcome> outcomes,
        List<ConsistencyCheckResult> checks
    ) {
        String reportId = run.getReportId();
        Map<String, Long> factsByStatus = new LinkedHashMap<>();
        for (ResolutionStatus status : ResolutionStatus.values()) {
            factsByStatus.put(status.name(), resolvedFactRepository.countByReportIdAndStatus(reportId, status));
        }
        AgreementStats agreement = resolutionService.agreement(reportId);

        long labelled = outcomes.stream().mapToLong(EngineOutcome::labelledRows).sum();
        long unmatched = outcomes.stream().mapToLong(EngineOutcome::unmatchedRows).sum();
        List<RunReport.EngineSummary> engines = outcomes.stream()
            .map(outcome -> new RunReport.EngineSummary(
                outcome.engine(),
                outcome.status().name(),
                outcome.artifacts(),
                outcome.tablesAccepted(),
                outcome.tablesRejected(),
                outcome.candidatesWritten(),
                outcome.unmatchedCandidates()
            ))
            .toList();

        return new RunReport(
            run.getRunId(),
            reportId,
            dictionary.version(),
            dictionary.contentHash(),
            Instant.now(),
            engines,
            run.getTablesRejected(),
            labelled == 0 ? 0.0 : (double) unmatched / labelled,
            factsByStatus,
            agreement.multiEngineGroups(),
            agreement.agreedGroups(),
            agreement.rate(),
            checks.size(),
            (int) checks.stream().filter(check -> !check.passed()).count(),
            checks
        );
    }

    private String toJson(RunReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run report", e);
        }
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
