package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReadFileToolTest {

    private static final String FILE_PATH = "filePath";

    @TempDir
    Path tempDir;

    private ReadFileTool tool;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        tool = new ReadFileTool(new Workspace(properties));
    }

    private ToolResult execute(Map<String, Object> params) {
        return tool.execute(params, ToolExecutionContext.of("c1", ReadFileTool.NAME)).join();
    }

    @Test
    void shouldReadWholeFile() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "line1\nline2\nline3");

        ToolResult result = execute(Map.of(FILE_PATH, "a.txt"));

        assertTrue(result.isSuccess());
        assertEquals("line1\nline2\nline3", result.getOutput());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(3, data.get("totalLines"));
        assertEquals("a.txt", data.get("path"));
    }

    @Test
    void shouldReadLineWindow() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "l0\nl1\nl2\nl3\nl4");

        ToolResult result = execute(Map.of(FILE_PATH, "a.txt", "offset", 1, "limit", 2));

        assertEquals("l1\nl2", result.getOutput());
        assertEquals(2, ((Map<?, ?>) result.getData()).get("lines"));
    }

    @Test
    void shouldAcceptNumericStrings() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "l0\nl1\nl2");

        ToolResult result = execute(Map.of(FILE_PATH, "a.txt", "offset", "2"));

        assertEquals("l2", result.getOutput());
    }

    @Test
    void shouldBeReadOnly() {
        assertTrue(tool.isReadOnly());
        assertEquals(ReadFileTool.NAME, tool.getToolName());
    }

    // ===== Edge Cases =====

    @Test
    void shouldFailForMissingFile() {
        ToolResult result = execute(Map.of(FILE_PATH, "missing.txt"));

        assertFalse(result.isSuccess());
        assertEquals("File not found: missing.txt", result.getError());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldDenyPathOutsideWorkspace() {
        ToolResult result = execute(Map.of(FILE_PATH, "../secret.txt"));

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
    }

    @Test
    void shouldRequireFilePath() {
        ToolResult result = execute(Map.of());

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
    }

    @Test
    void shouldRejectDirectory() throws Exception {
        Files.createDirectory(tempDir.resolve("dir"));

        ToolResult result = execute(Map.of(FILE_PATH, "dir"));

        assertEquals("Not a file: dir", result.getError());
    }

    @Test
    void shouldTruncateMiddleOfHugeContent() {
        String content = "a".repeat(ReadFileTool.MAX_CONTENT_CHARS) + "b".repeat(1000);

        String truncated = ReadFileTool.truncateMiddle(content);

        assertTrue(truncated.length() < content.length());
        assertTrue(truncated.startsWith("aaa"));
        assertTrue(truncated.endsWith("bbb"));
        assertTrue(truncated.contains("characters truncated"));
    }
}
