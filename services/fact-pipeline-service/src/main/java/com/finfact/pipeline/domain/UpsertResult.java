package com.finfact.pipeline.domain;

public enum UpsertResult {
    INSERTED,
    UPDATED,
    UNCHANGED,
    SKIPPED_VERIFIED
}
