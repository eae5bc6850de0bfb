package com.finfact.pipeline.candidate;

import com.finfact.pipeline.taxonomy.StatementType;
import java.math.BigDecimal;
import java.util.UUID;

public record FactCandidate(
    String metricCode,
    boolean matched,
    StatementType statementType,
    String rawLabel,
    String rawValue,
    BigDecimal value,
    String unit,
    String currency,
    ConsolidationScope scope,
    PeriodDescriptor period,
    String engine,
    UUID versionId,
    int pageNumber,
    String columnLabel,
    double quality
) {
}
