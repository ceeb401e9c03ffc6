package me.golemcore.agent.domain.execution;

import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.ExecutionEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownExecutionLogTest {

    private static final String SESSION_ID = "session-1";

    @TempDir
    Path tempDir;

    private Path logsDir;
    private ExecutionStreamManager stream;

    @BeforeEach
    void setUp() {
        logsDir = tempDir.resolve("logs");
        stream = new ExecutionStreamManager(SESSION_ID,
                Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldWriteMarkdownTraceOfExecution() throws IOException {
        MarkdownExecutionLog executionLog = MarkdownExecutionLog.open(logsDir, SESSION_ID);
        stream.on(executionLog);

        stream.start();
        stream.startThinking();
        stream.appendThinking("partial");
        stream.completeThinking("Need to read the build file first");
        stream.toolValidating("c1", "ReadFile", "read", "pom.xml", null);
        stream.toolExecuting("c1", "ReadFile");
        stream.toolComplete("c1", "ReadFile", "120 lines", 15);
        stream.toolError("c2", "Shell", "exit code 1", false, 40);
        stream.complete(0.0);

        String text = Files.readString(logsDir.resolve("session-1.md"));
        assertEquals(logsDir.resolve("session-1.md").toAbsolutePath().normalize(), executionLog.getFile());
        assertTrue(text.startsWith("# Execution log - session-1\n"));
        assertTrue(text.contains("## 12:00:00 Execution started"));
        assertTrue(text.contains("> Need to read the build file first"));
        assertTrue(text.contains("### 12:00:00 ReadFile\n- Params: pom.xml"));
        assertTrue(text.contains("ReadFile completed\n- Duration: 15 ms\n- Result: 120 lines"));
        assertTrue(text.contains("Shell failed\n- Error: exit code 1"));
        assertTrue(text.contains("Execution completed"));
        assertFalse(text.contains("partial"));
        assertFalse(text.contains("executing"));
    }

    @Test
    void shouldRecordCompressionAndCancellation() throws IOException {
        stream.on(MarkdownExecutionLog.open(logsDir, SESSION_ID));

        stream.compressionStart("auto", 40, 90_000);
        stream.compressionComplete(CompressionResult.builder()
                .compressed(true)
                .originalCount(40)
                .compressedCount(30)
                .originalTokens(90_000)
                .compressedTokens(20_000)
                .build());
        stream.cancel("user interrupt");

        String text = Files.readString(logsDir.resolve("session-1.md"));
        assertTrue(text.contains("Compression started\n- Tokens: 90000"));
        assertTrue(text.contains("- Tokens: 90000 -> 20000 (saved 78%)"));
        assertTrue(text.contains("Execution cancelled\n- Reason: user interrupt"));
    }

    @Test
    void shouldAppendResumeMarkerWhenReopened() throws IOException {
        MarkdownExecutionLog.open(logsDir, SESSION_ID)
                .onEvent(stream.emit(ExecutionEventType.EXECUTION_START, null));
        MarkdownExecutionLog.open(logsDir, SESSION_ID);

        String text = Files.readString(logsDir.resolve("session-1.md"));
        assertEquals(1, text.split("# Execution log", -1).length - 1);
        assertTrue(text.endsWith("_Session resumed_\n"));
    }

    // ===== Edge Cases =====

    @Test
    void shouldRejectSessionIdsEscapingLogsDirectory() {
        assertThrows(IllegalArgumentException.class, () -> MarkdownExecutionLog.open(logsDir, "../outside"));
        assertThrows(IllegalArgumentException.class, () -> MarkdownExecutionLog.open(logsDir, "a/b"));
        assertThrows(IllegalArgumentException.class, () -> MarkdownExecutionLog.open(logsDir, " "));
        assertFalse(Files.exists(tempDir.resolve("outside.md")));
    }

    @Test
    void shouldNotDisturbOtherListenersWhenLogFileIsGone() throws IOException {
        MarkdownExecutionLog executionLog = MarkdownExecutionLog.open(logsDir, SESSION_ID);
        stream.on(executionLog);
        int[] delivered = { 0 };
        stream.on(event -> delivered[0]++);
        Files.delete(executionLog.getFile());
        Files.delete(logsDir);

        stream.start();

        assertEquals(1, delivered[0]);
    }
}
