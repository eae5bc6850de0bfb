package com.finfact.pipeline.domain;

import com.finfact.pipeline.candidate.FactCandidate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "fact_candidates", indexes = {
    @Index(name = "idx_fact_candidates_report", columnList = "report_id"),
    @Index(name = "idx_fact_candidates_version", columnList = "version_id")
})
public class FactCandidateEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "report_id", nullable = false)
    private String reportId;

    @Column(name = "version_id", nullable = false)
    private UUID versionId;

    @Column(name = "engine", nullable = false)
    private String engine;

    @Column(name = "metric_code", nullable = false)
    private String metricCode;

    @Column(name = "matched", nullable = false)
    private boolean matched;

    @Column(name = "statement_type")
    private String statementType;

    @Column(name = "raw_label", length = 512)
    private String rawLabel;

    @Column(name = "raw_value", length = 256)
    private String rawValue;

    @Column(name = "fact_value", precision = 38, scale = 6)
    private BigDecimal value;

    @Column(name = "unit")
    private String unit;

    @Column(name = "currency")
    private String currency;

    @Column(name = "scope", nullable = false)
    private String scope;

    @Enumerated(EnumType.STRING)
    @Column(name = "fact_type", nullable = false)
    private FactType factType;

    @Column(name = "as_of_date")
    private LocalDate asOfDate;

    @Column(name = "period_start")
    private LocalDate periodStart;

    @Column(name = "period_end")
    private LocalDate periodEnd;

    @Column(name = "page_number")
    private int pageNumber;

    @Column(name = "column_label", length = 512)
    private String columnLabel;

    @Column(name = "quality", nullable = false)
    private double quality;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static FactCandidateEntity fromCandidate(String reportId, FactCandidate candidate) {
        FactCandidateEntity entity = new FactCandidateEntity();
        entity.id = UUID.randomUUID();
        entity.reportId = reportId;
        entity.versionId = candidate.versionId();
        entity.engine = candidate.engine();
        entity.metricCode = candidate.metricCode();
        entity.matched = candidate.matched();
        entity.statementType = candidate.statementType() == null ? null : candidate.statementType().code();
        entity.rawLabel = truncate(candidate.rawLabel(), 512);
        entity.rawValue = truncate(candidate.rawValue(), 256);
        entity.value = candidate.value();
        entity.unit = candidate.unit();
        entity.currency = candidate.currency();
        entity.scope = candidate.scope().code();
        entity.factType = candidate.period().factType();
        entity.asOfDate = candidate.period().asOfDate();
        entity.periodStart = candidate.period().periodStart();
        entity.periodEnd = candidate.period().periodEnd();
        entity.pageNumber = candidate.pageNumber();
        entity.columnLabel = truncate(candidate.columnLabel(), 512);
        entity.quality = candidate.quality();
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    private static String truncate(String text, int max) {
        return text == null || text.length() <= max ? text : text.substring(0, max);
    }

    public UUID getId() {
        return id;
    }

    public String getReportId() {
        return reportId;
    }

    public UUID getVersionId() {
        return versionId;
    }

    public String getEngine() {
        return engine;
    }

    public String getMetricCode() {
        return metricCode;
    }

    public boolean isMatched() {
        return matched;
    }

    public String getStatementType() {
        return statementType;
    }

    public String getRawLabel() {
        return rawLabel;
    }

    public String getRawValue() {
        return rawValue;
    }

    public BigDecimal getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public String getCurrency() {
        return currency;
    }

    public String getScope() {
        return scope;
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

    public int getPageNumber() {
        return pageNumber;
    }

    public String getColumnLabel() {
        return columnLabel;
    }

    public double getQuality() {
        return quality;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
