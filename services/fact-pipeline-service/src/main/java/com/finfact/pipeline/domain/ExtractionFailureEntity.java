package com.finfact.pipeline.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One recorded failure of an engine job; the job's version carries the outcome, this row the reason.
 */
@Entity
@Table(name = "extraction_failures", indexes = @Index(name = "idx_extraction_failures_run", columnList = "run_id"))
public class ExtractionFailureEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "engine", nullable = false)
    private String engine;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", nullable = false)
    private ExtractionFailureCode failureCode;

    @Column(name = "failure_reason", nullable = false, length = 1024)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static ExtractionFailureEntity of(UUID runId, String engine, ExtractionFailureCode code, String reason) {
        ExtractionFailureEntity entity = new ExtractionFailureEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.engine = engine;
        entity.failureCode = code;
        entity.failureReason = reason;
        entity.createdAt = Instant.now();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getEngine() {
        return engine;
    }

    public ExtractionFailureCode getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
