package com.finfact.pipeline.consensus;

import com.finfact.pipeline.domain.ResolutionStatus;
import java.math.BigDecimal;
import java.util.UUID;

public record GroupResolution(
    FactGroupKey key,
    ResolutionStatus status,
    BigDecimal value,
    UUID selectedCandidateId,
    int engineCount,
    int agreeingEngineCount,
    int candidateCount
) {
}
