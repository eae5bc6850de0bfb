package com.finfact.pipeline.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finfact.pipeline.domain.PipelineRunEntity;
import com.finfact.pipeline.service.PipelineRunCommand;
import com.finfact.pipeline.service.PipelineService;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pipeline")
public class PipelineController {

    private final PipelineService pipelineService;
    private final ObjectMapper objectMapper;

    public PipelineController(PipelineService pipelineService, ObjectMapper objectMapper) {
        this.pipelineService = pipelineService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> run(@Valid @RequestBody PipelineRunRequest request) {
        PipelineRunEntity run = pipelineService.run(new PipelineRunCommand(
            request.reportId().trim(),
            request.sourcePath() == null || request.sourcePath().isBlank() ? null : Path.of(request.sourcePath()),
            request.fiscalYear(),
            request.engines(),
            Boolean.TRUE.equals(request.overrideVerified())
        ));
        return ResponseEntity.accepted().body(Map.of("runId", run.getRunId(), "status", run.getStatus()));
    }

    @GetMapping("/runs/{runId}")
    public PipelineRunResponse getRun(@PathVariable UUID runId) {
        PipelineRunEntity run = pipelineService.getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));

        return new PipelineRunResponse(
            run.getRunId(),
            run.getReportId(),
            run.getStatus(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getEnginesRequested(),
            run.getEnginesSucceeded(),
            run.getEnginesFailed(),
            run.getCandidatesWritten(),
            run.getTablesRejected(),
            run.getFactsWritten(),
            run.getErrorSummary(),
            pipelineService.getRunVersions(runId).stream()
                .map(version -> new PipelineRunResponse.VersionItem(
                    version.getVersionId(),
                    version.getEngine(),
                    version.getStatus(),
                    version.getArtifactPaths(),
                    version.getErrorSummary()
                ))
                .toList(),
            pipelineService.getRunFailures(runId).stream()
                .map(failure -> new PipelineRunResponse.FailureItem(
                    failure.getEngine(),
                    failure.getFailureCode(),
                    failure.getFailureReason(),
                    failure.getCreatedAt()
                ))
                .toList(),
            parseReport(run.getRunReport())
        );
    }

    private JsonNode parseReport(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored run report is not valid JSON", e);
        }
    }
}
