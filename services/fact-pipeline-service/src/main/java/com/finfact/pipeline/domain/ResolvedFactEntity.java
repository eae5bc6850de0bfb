package com.finfact.pipeline.domain;

import com.finfact.pipeline.consensus.FactGroupKey;
import com.finfact.pipeline.consensus.GroupResolution;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical value of one fact group of one report.
 *
 * <p>{@code status} is what consumers read; {@code autoStatus} always records the last
 * automatic verdict, so agreement figures stay reproducible after a manual review.</p>
 */
@Entity
@Table(name = "resolved_facts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_resolved_facts_group", columnNames = {"report_id", "group_key"})
})
public class ResolvedFactEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "report_id", nullable = false, updatable = false)
    private String reportId;

    @Column(name = "group_key", nullable = false, updatable = false, length = 512)
    private String groupKey;

    @Column(name = "metric_code", nullable = false, updatable = false)
    private String metricCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "fact_type", nullable = false, updatable = false)
    private FactType factType;

    @Column(name = "as_of_date", updatable = false)
    private LocalDate asOfDate;

    @Column(name = "period_start", updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", updatable = false)
    private LocalDate periodEnd;

    @Column(name = "scope", nullable = false, updatable = false)
    private String scope;

    @Column(name = "currency", updatable = false)
    private String currency;

    @Column(name = "unit", updatable = false)
    private String unit;

    @Column(name = "fact_value", precision = 38, scale = 6)
    private BigDecimal value;

    @Column(name = "selected_candidate_id")
    private UUID selectedCandidateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ResolutionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false)
    private ResolutionMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "auto_status", nullable = false)
    private ResolutionStatus autoStatus;

    @Column(name = "engine_count", nullable = false)
    private int engineCount;

    @Column(name = "agreeing_engine_count", nullable = false)
    private int agreeingEngineCount;

    @Column(name = "candidate_count", nullable = false)
    private int candidateCount;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_notes", length = 2000)
    private String reviewNotes;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ResolvedFactEntity fromResolution(String reportId, GroupResolution resolution) {
        FactGroupKey key = resolution.key();
        ResolvedFactEntity entity = new ResolvedFactEntity();
        entity.id = UUID.randomUUID();
        entity.reportId = reportId;
        entity.groupKey = key.asString();
        entity.metricCode = key.metricCode();
        entity.factType = key.factType();
        entity.asOfDate = key.asOfDate();
        entity.periodStart = key.periodStart();
        entity.periodEnd = key.periodEnd();
        entity.scope = key.scope();
        entity.currency = key.currency();
        entity.unit = key.unit();
        entity.applyResolution(resolution);
        return entity;
    }

    /**
     * Replaces value and verdict with an automatic resolution, discarding any review.
     */
    public void applyResolution(GroupResolution resolution) {
        this.value = resolution.value();
        this.selectedCandidateId = resolution.selectedCandidateId();
        this.status = resolution.status();
        this.autoStatus = resolution.status();
        this.method = ResolutionMethod.CONSENSUS;
        this.engineCount = resolution.engineCount();
        this.agreeingEngineCount = resolution.agreeingEngineCount();
        this.candidateCount = resolution.candidateCount();
        this.reviewedBy = null;
        this.reviewedAt = null;
        this.reviewNotes = null;
    }

    public boolean hasChanged(GroupResolution resolution) {
        return status != resolution.status()
            || method != ResolutionMethod.CONSENSUS
            || !sameValue(value, resolution.value())
            || !Objects.equals(selectedCandidateId, resolution.selectedCandidateId())
            || engineCount != resolution.engineCount()
            || agreeingEngineCount != resolution.agreeingEngineCount()
            || candidateCount != resolution.candidateCount();
    }

    public void verify(UUID candidateId, BigDecimal chosenValue, String reviewer, String notes) {
        this.selectedCandidateId = candidateId;
        this.value = chosenValue;
        this.status = ResolutionStatus.VERIFIED;
        this.method = ResolutionMethod.MANUAL;
        this.reviewedBy = reviewer;
        this.reviewNotes = notes;
        this.reviewedAt = Instant.now();
    }

    public LocalDate referenceDate() {
        return factType == FactType.STOCK ? asOfDate : periodEnd;
    }

    private static boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getReportId() {
        return reportId;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public String getMetricCode() {
        return metricCode;
    }

    public FactType getFactType() {
        return factType;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public String getScope() {
        return scope;
    }

    public String getCurrency() {
        return currency;
    }

    public String getUnit() {
        return unit;
    }

    public BigDecimal getValue() {
        return value;
    }

    public UUID getSelectedCandidateId() {
        return selectedCandidateId;
    }

    public ResolutionStatus getStatus() {
        return status;
    }

    public ResolutionMethod getMethod() {
        return method;
    }

    public ResolutionStatus getAutoStatus() {
        return autoStatus;
    }

    public int getEngineCount() {
        return engineCount;
    }

    public int getAgreeingEngineCount() {
        return agreeingEngineCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewNotes() {
        return reviewNotes;
    }

    public long getRowVersion() {
        return rowVersion;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
