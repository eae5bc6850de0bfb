package com.finfact.pipeline.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "pipeline_runs")
public class PipelineRunEntity {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "report_id", nullable = false, updatable = false)
    private String reportId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status;

    @Column(name = "engines_requested", nullable = false)
    private int enginesRequested;

    @Column(name = "engines_succeeded", nullable = false)
    private int enginesSucceeded;

    @Column(name = "engines_failed", nullable = false)
    private int enginesFailed;

    @Column(name = "candidates_written", nullable = false)
    private int candidatesWritten;

    @Column(name = "tables_rejected", nullable = false)
    private int tablesRejected;

    @Column(name = "facts_written", nullable = false)
    private int factsWritten;

    @Column(name = "error_summary", length = 1024)
    private String errorSummary;

    @Column(name = "run_report", length = 200_000)
    private String runReport;

    public static PipelineRunEntity startNew(String reportId, int enginesRequested) {
        PipelineRunEntity run = new PipelineRunEntity();
        run.runId = UUID.randomUUID();
        run.reportId = reportId;
        run.enginesRequested = enginesRequested;
        run.startedAt = Instant.now();
        run.status = RunStatus.RUNNING;
        return run;
    }

    public void incrementEnginesSucceeded() {
        this.enginesSucceeded++;
    }

    public void incrementEnginesFailed() {
        this.enginesFailed++;
    }

    public void addCandidatesWritten(int count) {
        this.candidatesWritten += count;
    }

    public void addTablesRejected(int count) {
        this.tablesRejected += count;
    }

    public void setFactsWritten(int factsWritten) {
        this.factsWritten = factsWritten;
    }

    public void attachReport(String runReport) {
        this.runReport = runReport;
    }

    public void complete() {
        this.completedAt = Instant.now();
        this.status = this.enginesFailed > 0 ? RunStatus.PARTIAL_SUCCESS : RunStatus.SUCCEEDED;
    }

    public void fail(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getReportId() {
        return reportId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getEnginesRequested() {
        return enginesRequested;
    }

    public int getEnginesSucceeded() {
        return enginesSucceeded;
    }

    public int getEnginesFailed() {
        return enginesFailed;
    }

    public int getCandidatesWritten() {
        return candidatesWritten;
    }

    public int getTablesRejected() {
        return tablesRejected;
    }

    public int getFactsWritten() {
        return factsWritten;
    }

    public String getErrorSummary() {
        return errorSummary;
    }

    public String getRunReport() {
        return runReport;
    }
}
