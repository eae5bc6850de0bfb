package com.finfact.pipeline.service;

public class ResolutionInProgressException extends RuntimeException {

    public ResolutionInProgressException(String reportId) {
        super("Resolution already in progress for report " + reportId);
    }
}
