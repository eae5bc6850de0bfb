package com.finfact.pipeline.engine;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an external extraction tool through {@code sh -c} with a bounded timeout.
 *
 * <p>A non-zero exit or a launch failure is treated as transient and retried up to the
 * invocation's attempt limit. A timeout kills the process and is not retried; whatever the
 * tool already wrote stays in the output directory and may still be consumed.</p>
 */
@Component
public class EngineInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineInvoker.class);
    static final String LOG_FILE = "engine.log";

    public void run(EngineInvocation invocation) {
        if (invocation.discoveryOnly()) {
            LOGGER.debug("Engine {} has no command, discovering existing artifacts only", invocation.engine());
            return;
        }
        try {
            Files.createDirectories(invocation.outputDir());
        } catch (IOException e) {
            throw new EngineExecutionException("Cannot create output directory " + invocation.outputDir(), e);
        }

        String command = render(invocation);
        int attempts = Math.max(1, invocation.maxAttempts());
        EngineExecutionException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                runOnce(invocation, command);
                return;
            } catch (EngineExecutionException ex) {
                if (ex.isTimedOut() || Thread.currentThread().isInterrupted()) {
                    throw ex;
                }
                last = ex;
                LOGGER.warn("Engine {} attempt {}/{} failed: {}", invocation.engine(), attempt, attempts, ex.getMessage());
            }
        }
        throw last;
    }

    private void runOnce(EngineInvocation invocation, String command) {
        File log = invocation.outputDir().resolve(LOG_FILE).toFile();
        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(log))
                .start();
        } catch (IOException e) {
            throw new EngineExecutionException("Failed to start engine " + invocation.engine(), e);
        }

        try {
            boolean finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new EngineExecutionException(
                    "Engine " + invocation.engine() + " timed out after " + invocation.timeout().toSeconds() + "s", true);
            }
            int exit = process.exitValue();
            if (exit != 0) {
                throw new EngineExecutionException("Engine " + invocation.engine() + " exited with code " + exit, false);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new EngineExecutionException("Interrupted while waiting for engine " + invocation.engine(), e);
        }
    }

    static String render(EngineInvocation invocation) {
        String input = invocation.input() == null ? "" : quote(invocation.input());
        return invocation.command()
            .replace("{input}", input)
            .replace("{output}", quote(invocation.outputDir()));
    }

    private static String quote(Path path) {
        return "'" + path.toAbsolutePath().toString().replace("'", "'\\''") + "'";
    }
}
