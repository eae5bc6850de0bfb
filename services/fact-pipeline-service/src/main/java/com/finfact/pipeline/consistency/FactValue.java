package com.finfact.pipeline.consistency;

import com.finfact.pipeline.domain.ResolutionStatus;
import java.math.BigDecimal;
import java.time.LocalDate;

public record FactValue(
    String metricCode,
    String scope,
    LocalDate date,
    String unit,
    BigDecimal value,
    ResolutionStatus status
) {
}
