/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ReadOnlyChecker;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a text file from the workspace, optionally a line window of it.
 * Content beyond {@link #MAX_CONTENT_CHARS} keeps its head and tail with a
 * marker in between.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent, ReadOnlyChecker {

    static final String NAME = "ReadFile";
    static final int MAX_CONTENT_CHARS = 100_000;
    private static final long MAX_FILE_SIZE = 10L * 1024 * 1024;

    private final Workspace workspace;

    public ReadFileTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Read the contents of a file in the workspace.
                        Supports paging large files with offset (0-based start line) and limit (line count).
                        Returns the content plus size and line counts.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "filePath", ToolArguments.property("string", "Path of the file, relative to workspace"),
                                "offset", ToolArguments.property("integer", "First line to read (0-based)"),
                                "limit", ToolArguments.property("integer", "Number of lines to read")),
                        "required", List.of("filePath")))
                .build();
    }

    @Override
    public boolean isReadOnly() {
        return true;
    }

    @Override
    public String getCategory() {
        return "read";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> read(parameters));
    }

    private ToolResult read(Map<String, Object> parameters) {
        String pathStr = ToolArguments.string(parameters, "filePath");
        if (pathStr == null || pathStr.isBlank()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Missing required parameter: filePath");
        }
        Optional<Path> resolved = workspace.resolve(pathStr);
        if (resolved.isEmpty()) {
            log.warn("[ReadFile] Path outside workspace: {}", pathStr);
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
        }
        Path path = resolved.get();
        if (!Files.exists(path)) {
            return ToolResult.failure("File not found: " + pathStr);
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Not a file: " + pathStr);
        }

        try {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                return ToolResult.failure("File too large (max " + MAX_FILE_SIZE / 1024 / 1024 + " MB)");
            }
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            int totalLines = lines.size();
            int offset = ToolArguments.integer(parameters, "offset", 0);
            int limit = ToolArguments.integer(parameters, "limit", totalLines);
            int start = Math.max(0, Math.min(offset, Math.max(totalLines - 1, 0)));
            int end = Math.min(start + Math.max(limit, 0), totalLines);

            String content = String.join("\n", lines.subList(start, end));
            boolean truncated = false;
            if (content.length() > MAX_CONTENT_CHARS) {
                content = truncateMiddle(content);
                truncated = true;
            }

            return ToolResult.success(content, Map.of(
                    "path", workspace.relativize(path),
                    "size", size,
                    "lines", end - start,
                    "totalLines", totalLines,
                    "truncated", truncated));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    static String truncateMiddle(String content) {
        int half = MAX_CONTENT_CHARS / 2 - 100;
        int omitted = content.length() - 2 * half;
        return content.substring(0, half)
                + "\n\n... [" + omitted + " characters truncated] ...\n\n"
                + content.substring(content.length() - half);
    }
}
