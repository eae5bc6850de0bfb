package com.finfact.pipeline.domain;

public enum ResolutionStatus {
    AUTO_AGREED,
    AUTO_SINGLE_ENGINE,
    UNRESOLVED,
    VERIFIED
}
