package com.finfact.pipeline.consensus;

import java.math.BigDecimal;
import java.util.UUID;

public record CandidateObservation(
    UUID candidateId,
    String engine,
    FactGroupKey key,
    BigDecimal value,
    String columnLabel,
    double quality,
    boolean matched
) {
}
