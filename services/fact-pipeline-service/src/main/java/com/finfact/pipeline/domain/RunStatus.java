package com.finfact.pipeline.domain;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED
}
