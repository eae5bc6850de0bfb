package com.finfact.pipeline.engine;

public class EngineExecutionException extends RuntimeException {

    private final boolean timedOut;

    public EngineExecutionException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public EngineExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
