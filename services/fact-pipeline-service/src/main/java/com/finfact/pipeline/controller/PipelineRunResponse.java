package com.finfact.pipeline.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.finfact.pipeline.domain.ExtractionFailureCode;
import com.finfact.pipeline.domain.RunStatus;
import com.finfact.pipeline.domain.VersionStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PipelineRunResponse(
    UUID runId,
    String reportId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int enginesRequested,
    int enginesSucceeded,
    int enginesFailed,
    int candidatesWritten,
    int tablesRejected,
    int factsWritten,
    String errorSummary,
    List<VersionItem> versions,
    List<FailureItem> recentFailures,
    JsonNode runReport
) {
    public record VersionItem(UUID versionId, String engine, VersionStatus status, List<String> artifacts, String errorSummary) {
    }

    public record FailureItem(String engine, ExtractionFailureCode code, String reason, Instant createdAt) {
    }
}
