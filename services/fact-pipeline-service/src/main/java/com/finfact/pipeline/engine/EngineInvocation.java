package com.finfact.pipeline.engine;

import java.nio.file.Path;
import java.time.Duration;

public record EngineInvocation(
    String engine,
    String command,
    Path input,
    Path outputDir,
    Duration timeout,
    int maxAttempts
) {
    public boolean discoveryOnly() {
        return command == null || command.isBlank();
    }
}
