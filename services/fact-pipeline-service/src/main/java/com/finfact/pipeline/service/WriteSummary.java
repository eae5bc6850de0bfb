package com.finfact.pipeline.service;

public record WriteSummary(int inserted, int updated, int unchanged, int skippedVerified, int deleted) {

    public int written() {
        return inserted + updated;
    }
}
