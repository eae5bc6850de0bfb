package com.finfact.pipeline.domain;

public enum ExtractionFailureCode {
    ENGINE_TIMEOUT,
    ENGINE_ERROR,
    NO_ARTIFACTS,
    PROCESSING_ERROR
}
