package me.golemcore.agent.tools;

import me.golemcore.agent.domain.tool.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessRunnerTest {

    @TempDir
    Path tempDir;

    private ProcessRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ProcessRunner();
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void shouldCollectMergedOutput() throws IOException {
        ProcessRunner.ProcessOutcome outcome = runner.run(List.of("/bin/sh", "-c", "echo out; echo err 1>&2"),
                tempDir, null, 10, 10_000, new CancellationSignal());

        assertTrue(outcome.exited());
        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.output().contains("out\n"));
        assertTrue(outcome.output().contains("err\n"));
        assertFalse(outcome.truncated());
    }

    @Test
    void shouldTruncateOutput() throws IOException {
        ProcessRunner.ProcessOutcome outcome = runner.run(List.of("/bin/sh", "-c", "seq 1 1000"),
                tempDir, null, 10, 50, new CancellationSignal());

        assertTrue(outcome.truncated());
        assertTrue(outcome.output().length() <= 50);
    }

    @Test
    void shouldTimeOut() throws IOException {
        ProcessRunner.ProcessOutcome outcome = runner.run(List.of("/bin/sh", "-c", "sleep 30"),
                tempDir, null, 1, 10_000, new CancellationSignal());

        assertEquals(ProcessRunner.Status.TIMED_OUT, outcome.status());
        assertEquals(-1, outcome.exitCode());
    }

    @Test
    void shouldTerminateOnCancel() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS).execute(() -> signal.cancel("stop"));
        long start = System.currentTimeMillis();

        ProcessRunner.ProcessOutcome outcome = runner.run(List.of("/bin/sh", "-c", "sleep 30"),
                tempDir, null, 60, 10_000, signal);

        assertEquals(ProcessRunner.Status.CANCELLED, outcome.status());
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void shouldThrowWhenExecutableMissing() {
        assertThrows(IOException.class, () -> runner.run(List.of("definitely-not-a-real-binary-42"),
                tempDir, null, 10, 10_000, new CancellationSignal()));
    }
}
