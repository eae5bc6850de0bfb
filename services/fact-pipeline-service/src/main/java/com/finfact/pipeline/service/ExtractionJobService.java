package com.finfact.pipeline.service;

import com.finfact.pipeline.artifact.ArtifactLocator;
import com.finfact.pipeline.artifact.ArtifactReadException;
import com.finfact.pipeline.artifact.ArtifactReaders;
import com.finfact.pipeline.artifact.RawTableCandidate;
import com.finfact.pipeline.candidate.BuildContext;
import com.finfact.pipeline.candidate.CandidateBuilder;
import com.finfact.pipeline.candidate.TableCandidates;
import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.ExtractionFailureCode;
import com.finfact.pipeline.domain.ExtractionFailureEntity;
import com.finfact.pipeline.domain.ReportVersionEntity;
import com.finfact.pipeline.domain.VersionStatus;
import com.finfact.pipeline.engine.EngineExecutionException;
import com.finfact.pipeline.engine.EngineInvocation;
import com.finfact.pipeline.engine.EngineInvoker;
import com.finfact.pipeline.repository.ExtractionFailureRepository;
import com.finfact.pipeline.repository.ReportVersionRepository;
import com.finfact.pipeline.taxonomy.MetricDictionary;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class ExtractionJobService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionJobService.class);
    private static final String REPORT_PLACEHOLDER = "{report}";

    private final PipelineProperties properties;
    private final EngineInvoker engineInvoker;
    private final ArtifactLocator artifactLocator;
    private final ArtifactReaders artifactReaders;
    private final CandidateBuilder candidateBuilder;
    private final CandidatePersistenceService candidatePersistenceService;
    private final ReportVersionRepository reportVersionRepository;
    private final ExtractionFailureRepository extractionFailureRepository;
    private final ThreadPoolTaskExecutor extractionExecutor;

    public ExtractionJobService(
        PipelineProperties properties,
        EngineInvoker engineInvoker,
        ArtifactLocator artifactLocator,
        ArtifactReaders artifactReaders,
        CandidateBuilder candidateBuilder,
        CandidatePersistenceService candidatePersistenceService,
        ReportVersionRepository reportVersionRepository,
        ExtractionFailureRepository extractionFailureRepository,
        ThreadPoolTaskExecutor extractionExecutor
    ) {
        this.properties = properties;
        this.engineInvoker = engineInvoker;
        this.artifactLocator = artifactLocator;
        this.artifactReaders = artifactReaders;
        this.candidateBuilder = candidateBuilder;
        this.candidatePersistenceService = candidatePersistenceService;
        this.reportVersionRepository = reportVersionRepository;
        this.extractionFailureRepository = extractionFailureRepository;
        this.extractionExecutor = extractionExecutor;
    }

    public List<PipelineProperties.Engine> selectEngines(List<String> requested) {
        List<PipelineProperties.Engine> configured = properties.getEngines();
        if (requested == null || requested.isEmpty()) {
            return configured;
        }
        List<PipelineProperties.Engine> selected = new ArrayList<>();
        for (String name : requested) {
            PipelineProperties.Engine engine = configured.stream()
                .filter(candidate -> candidate.getName().equalsIgnoreCase(name.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown engine: " + name));
            selected.add(engine);
        }
        return selected;
    }

    public List<EngineOutcome> extractAll(
        UUID runId,
        PipelineRunCommand command,
        List<PipelineProperties.Engine> engines,
        MetricDictionary dictionary
    ) {
        List<CompletableFuture<EngineOutcome>> jobs = engines.stream()
            .map(engine -> CompletableFuture.supplyAsync(
                () -> extractOne(runId, command, engine, dictionary), extractionExecutor))
            .toList();
        CompletableFuture.allOf(jobs.toArray(new CompletableFuture[0])).exceptionally(ignored -> null).join();

        List<EngineOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            CompletableFuture<EngineOutcome> job = jobs.get(i);
            if (job.isCompletedExceptionally()) {
                String engine = engines.get(i).getName();
                Throwable cause = job.handle((value, error) -> error).join();
                LOGGER.error("Extraction job for engine {} crashed", engine, cause);
                recordFailure(runId, engine, ExtractionFailureCode.PROCESSING_ERROR, cause);
                outcomes.add(new EngineOutcome(engine, null, VersionStatus.FAILED, 0, 0, 0, 0, 0, 0, 0));
            } else {
                outcomes.add(job.join());
            }
        }
        return outcomes;
    }

    EngineOutcome extractOne(
        UUID runId,
        PipelineRunCommand command,
        PipelineProperties.Engine engine,
        MetricDictionary dictionary
    ) {
        MDC.put("engine", engine.getName());
        try {
            Path outputDir = resolveDir(engine.getOutputDir(), command.reportId(), Path.of("data", "engines", engine.getName(), command.reportId()));
            Path fallbackDir = engine.getFallbackDir() == null || engine.getFallbackDir().isBlank()
                ? null
                : resolveDir(engine.getFallbackDir(), command.reportId(), null);
            ReportVersionEntity version = reportVersionRepository.save(
                ReportVersionEntity.startNew(command.reportId(), engine.getName(), runId, outputDir.toString()));
            try {
                return harvest(runId, command, engine, dictionary, version, outputDir, fallbackDir);
            } catch (RuntimeException crash) {
                if (!version.getStatus().isTerminal()) {
                    version.finish(VersionStatus.FAILED, List.of(), truncate(crash.getMessage(), 400));
                    reportVersionRepository.save(version);
                }
                throw crash;
            }
        } finally {
            MDC.remove("engine");
        }
    }

    private EngineOutcome harvest(
        UUID runId,
        PipelineRunCommand command,
        PipelineProperties.Engine engine,
        MetricDictionary dictionary,
        ReportVersionEntity version,
        Path outputDir,
        Path fallbackDir
    ) {
        boolean engineFailed = false;
        String errorSummary = null;
        try {
            engineInvoker.run(new EngineInvocation(
                engine.getName(),
                engine.getCommand(),
                command.source(),
                outputDir,
                Duration.ofSeconds(Math.max(1, engine.getTimeoutSeconds())),
                engine.getMaxAttempts()
            ));
        } catch (EngineExecutionException ex) {
            engineFailed = true;
            errorSummary = truncate(ex.getMessage(), 400);
            recordFailure(runId, engine.getName(),
                ex.isTimedOut() ? ExtractionFailureCode.ENGINE_TIMEOUT : ExtractionFailureCode.ENGINE_ERROR, ex);
        }

        List<Path> artifacts = artifactLocator.locate(outputDir, fallbackDir);
        if (artifacts.isEmpty()) {
            if (!engineFailed) {
                errorSummary = "No artifacts found in " + outputDir;
                recordFailure(runId, engine.getName(), ExtractionFailureCode.NO_ARTIFACTS, errorSummary);
            }
            version.finish(VersionStatus.FAILED, List.of(), errorSummary);
            reportVersionRepository.save(version);
            return new EngineOutcome(engine.getName(), version.getVersionId(), VersionStatus.FAILED, 0, 0, 0, 0, 0, 0, 0);
        }

        Tally tally = new Tally();
        BuildContext context = new BuildContext(command.reportId(), version.getVersionId(), command.fiscalYear());
        boolean readErrors = false;
        for (Path artifact : artifacts) {
            try {
                for (RawTableCandidate table : artifactReaders.read(engine.getName(), artifact)) {
                    TableCandidates built = candidateBuilder.build(dictionary, table, context);
                    tally.add(built, candidatePersistenceService.saveAll(command.reportId(), built.candidates()));
                }
            } catch (ArtifactReadException ex) {
                readErrors = true;
                LOGGER.warn("Skipping unreadable artifact {}: {}", artifact, ex.getMessage());
                recordFailure(runId, engine.getName(), ExtractionFailureCode.PROCESSING_ERROR, ex);
            }
        }

        VersionStatus status = engineFailed ? VersionStatus.FAILED : readErrors ? VersionStatus.PARTIAL : VersionStatus.SUCCEEDED;
        version.finish(status, artifacts.stream().map(Path::toString).toList(), errorSummary);
        reportVersionRepository.save(version);
        LOGGER.info("Engine {} finished {}: {} artifacts, {} tables accepted, {} rejected, {} candidates",
            engine.getName(), status, artifacts.size(), tally.accepted, tally.rejected, tally.candidates);
        return new EngineOutcome(engine.getName(), version.getVersionId(), status, artifacts.size(),
            tally.accepted, tally.rejected, tally.candidates, tally.unmatchedCandidates, tally.labelledRows, tally.unmatchedRows);
    }

    private void recordFailure(UUID runId, String engine, ExtractionFailureCode code, Throwable cause) {
        recordFailure(runId, engine, code, truncate(cause == null ? null : cause.getMessage(), 400));
    }

    private void recordFailure(UUID runId, String engine, ExtractionFailureCode code, String reason) {
        extractionFailureRepository.save(ExtractionFailureEntity.of(runId, engine, code, truncate(reason, 400)));
    }

    private static Path resolveDir(String template, String reportId, Path fallback) {
        if (template == null || template.isBlank()) {
            return fallback;
        }
        return Path.of(template.replace(REPORT_PLACEHOLDER, reportId));
    }

    private static String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static final class Tally {
        private int accepted;
        private int rejected;
        private int candidates;
        private int unmatchedCandidates;
        private int labelledRows;
        private int unmatchedRows;

        private void add(TableCandidates built, int written) {
            if (built.accepted()) {
                accepted++;
                labelledRows += built.labelledRows();
                unmatchedRows += built.unmatchedRows();
                unmatchedCandidates += (int) built.candidates().stream().filter(c -> !c.matched()).count();
            } else {
                rejected++;
            }
            candidates += written;
        }
    }
}
