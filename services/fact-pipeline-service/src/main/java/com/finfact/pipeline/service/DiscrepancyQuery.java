package com.finfact.pipeline.service;

import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import java.time.LocalDate;

public record DiscrepancyQuery(
    String reportId,
    FactType factType,
    Integer fiscalYear,
    LocalDate period,
    ResolutionStatus status,
    int limit
) {
}
