package com.finfact.pipeline.controller;

import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionMethod;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.domain.ResolvedFactEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record ResolvedFactResponse(
    UUID id,
    String reportId,
    String groupKey,
    String metricCode,
    FactType factType,
    LocalDate asOfDate,
    LocalDate periodStart,
    LocalDate periodEnd,
    String scope,
    String currency,
    String unit,
    BigDecimal value,
    UUID selectedCandidateId,
    ResolutionStatus status,
    ResolutionMethod method,
    ResolutionStatus autoStatus,
    int engineCount,
    int agreeingEngineCount,
    int candidateCount,
    String reviewedBy,
    Instant reviewedAt,
    String reviewNotes
) {
    public static ResolvedFactResponse from(ResolvedFactEntity entity) {
        return new ResolvedFactResponse(
            entity.getId(),
            entity.getReportId(),
            entity.getGroupKey(),
            entity.getMetricCode(),
            entity.getFactType(),
            entity.getAsOfDate(),
            entity.getPeriodStart(),
            entity.getPeriodEnd(),
            entity.getScope(),
            entity.getCurrency(),
            entity.getUnit(),
            entity.getValue(),
            entity.getSelectedCandidateId(),
            entity.getStatus(),
            entity.getMethod(),
            entity.getAutoStatus(),
            entity.getEngineCount(),
            entity.getAgreeingEngineCount(),
            entity.getCandidateCount(),
            entity.getReviewedBy(),
            entity.getReviewedAt(),
            entity.getReviewNotes()
        );
    }
}
