package com.finfact.pipeline.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("EngineInvoker")
@EnabledOnOs({OS.LINUX, OS.MAC})
class EngineInvokerTest {

    @TempDir
    Path workDir;

    private EngineInvoker invoker;
    private Path output;

    @BeforeEach
    void setUp() {
        invoker = new EngineInvoker();
        output = workDir.resolve("out");
    }

    private EngineInvocation invocation(String command, Duration timeout, int maxAttempts) {
        return new EngineInvocation("mineru", command, workDir.resolve("report.pdf"), output, timeout, maxAttempts);
    }

    @Test
    void successfulRunWritesArtifactsAndLog() {
        invoker.run(invocation("echo converted {input} > {output}/report.md", Duration.ofSeconds(10), 1));

        assertThat(output.resolve("report.md")).exists();
        assertThat(output.resolve(EngineInvoker.LOG_FILE)).exists();
    }

    @Test
    void nonZeroExitIsRetried() {
        String flaky = "if [ -f {output}/attempted ]; then echo ok > {output}/report.md; else touch {output}/attempted; exit 3; fi";

        invoker.run(invocation(flaky, Duration.ofSeconds(10), 2));

        assertThat(output.resolve("report.md")).exists();
    }

    @Test
    void exhaustedAttemptsReportTheExitCode() {
        assertThatThrownBy(() -> invoker.run(invocation("exit 7", Duration.ofSeconds(10), 2)))
            .isInstanceOf(EngineExecutionException.class)
            .hasMessageContaining("exited with code 7")
            .satisfies(ex -> assertThat(((EngineExecutionException) ex).isTimedOut()).isFalse());
    }

    @Test
    void timeoutKillsTheProcessWithoutRetry() {
        String slow = "echo started >> {output}/attempts; sleep 5";
        long started = System.nanoTime();

        assertThatThrownBy(() -> invoker.run(invocation(slow, Duration.ofMillis(300), 3)))
            .isInstanceOf(EngineExecutionException.class)
            .satisfies(ex -> assertThat(((EngineExecutionException) ex).isTimedOut()).isTrue());

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void blankCommandOnlyDiscovers() {
        invoker.run(invocation("  ", Duration.ofSeconds(1), 1));

        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void renderQuotesPaths() {
        EngineInvocation quoted = new EngineInvocation(
            "docling", "tool {input} -o {output}", Path.of("/data/it's.pdf"), Path.of("/out/dir"), Duration.ofSeconds(1), 1);

        assertThat(EngineInvoker.render(quoted)).isEqualTo("tool '/data/it'\\''s.pdf' -o '/out/dir'");
    }
}
