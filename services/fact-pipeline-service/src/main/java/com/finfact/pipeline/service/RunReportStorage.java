package com.finfact.pipeline.service;

import java.util.UUID;

public interface RunReportStorage {

    /**
     * @return location of the stored report
     */
    String store(String reportId, UUID runId, String reportJson);
}
