package com.finfact.pipeline.artifact;

public class ArtifactReadException extends RuntimeException {

    public ArtifactReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
