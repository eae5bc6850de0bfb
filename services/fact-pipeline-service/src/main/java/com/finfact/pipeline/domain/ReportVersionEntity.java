package com.finfact.pipeline.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "report_versions")
public class ReportVersionEntity {

    @Id
    @Column(name = "version_id", nullable = false, updatable = false)
    private UUID versionId;

    @Column(name = "report_id", nullable = false, updatable = false)
    private String reportId;

    @Column(name = "engine", nullable = false, updatable = false)
    private String engine;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private VersionStatus status;

    @Column(name = "output_dir", length = 1024)
    private String outputDir;

    @Column(name = "artifact_paths", length = 16_000)
    private String artifactPaths;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_summary", length = 1024)
    private String errorSummary;

    public static ReportVersionEntity startNew(String reportId, String engine, UUID runId, String outputDir) {
        ReportVersionEntity version = new ReportVersionEntity();
        version.versionId = UUID.randomUUID();
        version.reportId = reportId;
        version.engine = engine;
        version.runId = runId;
        version.outputDir = outputDir;
        version.startedAt = Instant.now();
        version.status = VersionStatus.RUNNING;
        return version;
    }

    public void finish(VersionStatus terminalStatus, List<String> artifacts, String errorSummary) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Report version " + versionId + " is already " + status);
        }
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        this.status = terminalStatus;
        this.artifactPaths = artifacts == null || artifacts.isEmpty() ? null : String.join("\n", artifacts);
        this.errorSummary = errorSummary;
        this.completedAt = Instant.now();
    }

    public UUID getVersionId() {
        return versionId;
    }

    public String getReportId() {
        return reportId;
    }

    public String getEngine() {
        return engine;
    }

    public UUID getRunId() {
        return runId;
    }

    public VersionStatus getStatus() {
        return status;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public List<String> getArtifactPaths() {
        return artifactPaths == null ? List.of() : Arrays.asList(artifactPaths.split("\n"));
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}
