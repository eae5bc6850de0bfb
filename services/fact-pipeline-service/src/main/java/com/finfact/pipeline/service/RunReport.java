package com.finfact.pipeline.service;

import com.finfact.pipeline.consistency.ConsistencyCheckResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RunReport(
    UUID runId,
    String reportId,
    String dictionaryVersion,
    String dictionaryHash,
    Instant generatedAt,
    List<EngineSummary> engines,
    int tablesRejected,
    double unmatchedLabelRate,
    Map<String, Long> factsByStatus,
    long multiEngineGroups,
    long agreedGroups,
    double agreementRate,
    int consistencyChecks,
    int consistencyFailures,
    List<ConsistencyCheckResult> checks
) {
    public record EngineSummary(
        String engine,
        String status,
        int artifacts,
        int tablesAccepted,
        int tablesRejected,
        int candidates,
        int unmatchedCandidates
    ) {
    }
}
