package com.finfact.pipeline.service;

public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }
}
