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
import me.golemcore.agent.domain.component.ConfirmationRequirer;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.Allowlist;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Writes or appends text to a workspace file, creating parent directories.
 *
 * <p>
 * Asks for an EDIT confirmation in {@link ApprovalMode#DEFAULT}; file edits are
 * auto-approved in {@link ApprovalMode#AUTO_EDIT} and {@link ApprovalMode#YOLO}.
 * An "always allow" answer is remembered per path.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent, ConfirmationRequirer {

    static final String NAME = "WriteFile";
    private static final int PREVIEW_CHARS = 2000;

    private final Workspace workspace;

    public WriteFileTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Write content to a file in the workspace. Overwrites by default, or appends when append is true.
                        Missing parent directories are created.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "filePath", ToolArguments.property("string", "Path of the file, relative to workspace"),
                                "content", ToolArguments.property("string", "Content to write"),
                                "append", ToolArguments.property("boolean", "Append instead of overwrite")),
                        "required", List.of("filePath", "content")))
                .build();
    }

    @Override
    public String getCategory() {
        return "edit";
    }

    @Override
    public Optional<ConfirmDetails> shouldConfirmExecute(Map<String, Object> parameters, ApprovalMode mode,
            ToolExecutionContext context, Allowlist allowlist) {
        if (mode == ApprovalMode.YOLO || mode == ApprovalMode.AUTO_EDIT) {
            return Optional.empty();
        }
        String filePath = ToolArguments.string(parameters, "filePath");
        if (filePath != null && allowlist.has(allowlistKey(filePath))) {
            return Optional.empty();
        }
        boolean append = ToolArguments.bool(parameters, "append", false);
        String content = ToolArguments.string(parameters, "content");
        ConfirmDetails details = ConfirmDetails.edit(append ? "Append to file" : "Overwrite file", filePath,
                preview(content));
        details.setAllowlistKey(allowlistKey(filePath));
        return Optional.of(details);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> write(parameters));
    }

    private ToolResult write(Map<String, Object> parameters) {
        String pathStr = ToolArguments.string(parameters, "filePath");
        String content = ToolArguments.string(parameters, "content");
        if (pathStr == null || pathStr.isBlank() || content == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Missing required parameters: filePath and content");
        }
        Optional<Path> resolved = workspace.resolve(pathStr);
        if (resolved.isEmpty()) {
            log.warn("[WriteFile] Path outside workspace: {}", pathStr);
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
        }
        Path path = resolved.get();
        if (Files.isDirectory(path)) {
            return ToolResult.failure("Path is a directory: " + pathStr);
        }

        boolean append = ToolArguments.bool(parameters, "append", false);
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            if (append) {
                Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            }
            String relative = workspace.relativize(path);
            log.info("[WriteFile] {} {} bytes to {}", append ? "Appended" : "Wrote", bytes.length, relative);
            return ToolResult.success((append ? "Appended " : "Wrote ") + bytes.length + " bytes to " + relative,
                    Map.of("path", relative, "bytes", bytes.length, "append", append));
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }

    static String allowlistKey(String filePath) {
        return "edit:" + filePath;
    }

    private static String preview(String content) {
        if (content == null || content.length() <= PREVIEW_CHARS) {
            return content;
        }
        return content.substring(0, PREVIEW_CHARS) + "\n... [" + (content.length() - PREVIEW_CHARS) + " more characters]";
    }
}
