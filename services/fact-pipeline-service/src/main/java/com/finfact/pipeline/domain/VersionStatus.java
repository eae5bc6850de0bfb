package com.finfact.pipeline.domain;

public enum VersionStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
