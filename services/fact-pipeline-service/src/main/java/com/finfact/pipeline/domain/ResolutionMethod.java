package com.finfact.pipeline.domain;

public enum ResolutionMethod {
    CONSENSUS,
    MANUAL
}
