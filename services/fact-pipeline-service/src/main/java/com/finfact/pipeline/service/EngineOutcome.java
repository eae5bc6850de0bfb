package com.finfact.pipeline.service;

import com.finfact.pipeline.domain.VersionStatus;
import java.util.UUID;

public record EngineOutcome(
    String engine,
    UUID versionId,
    VersionStatus status,
    int artifacts,
    int tablesAccepted,
    int tablesRejected,
    int candidatesWritten,
    int unmatchedCandidates,
    int labelledRows,
    int unmatchedRows
) {
    public boolean succeeded() {
        return status == VersionStatus.SUCCEEDED || status == VersionStatus.PARTIAL;
    }

    /**
     * True when the engine left artifacts behind, even if its version ended {@code FAILED}.
     */
    public boolean producedArtifacts() {
        return artifacts > 0;
    }
}
