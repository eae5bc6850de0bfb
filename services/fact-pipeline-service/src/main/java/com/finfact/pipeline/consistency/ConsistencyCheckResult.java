package com.finfact.pipeline.consistency;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ConsistencyCheckResult(
    String name,
    String scope,
    LocalDate date,
    String formula,
    BigDecimal lhs,
    BigDecimal rhs,
    BigDecimal residual,
    boolean passed
) {
}
