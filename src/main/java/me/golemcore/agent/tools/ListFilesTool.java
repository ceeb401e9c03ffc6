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

import me.golemcore.agent.domain.component.ReadOnlyChecker;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists one directory of the workspace, directories first.
 */
@Component
public class ListFilesTool implements ToolComponent, ReadOnlyChecker {

    static final String NAME = "ListFiles";
    static final int MAX_ENTRIES = 200;

    private final Workspace workspace;

    public ListFilesTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List files and folders in a directory. Defaults to the workspace root.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "directory", ToolArguments.property("string",
                                        "Directory to list, relative to workspace")),
                        "required", List.of()))
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
        return CompletableFuture.supplyAsync(() -> list(ToolArguments.string(parameters, "directory")));
    }

    private ToolResult list(String directory) {
        Optional<Path> resolved = workspace.resolve(directory);
        if (resolved.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
        }
        Path path = resolved.get();
        if (!Files.exists(path)) {
            return ToolResult.failure("Directory not found: " + directory);
        }
        if (!Files.isDirectory(path)) {
            return ToolResult.failure("Not a directory: " + directory);
        }

        List<Path> entries;
        try (Stream<Path> stream = Files.list(path)) {
            entries = stream
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            return ToolResult.failure("Failed to list directory: " + e.getMessage());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Directory: ").append(workspace.relativize(path)).append('\n');
        sb.append("Entries: ").append(entries.size()).append("\n\n");
        for (Path entry : entries.subList(0, Math.min(entries.size(), MAX_ENTRIES))) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry)) {
                sb.append("[DIR]  ").append(name).append("/\n");
            } else {
                sb.append("[FILE] ").append(name).append('\n');
            }
        }
        if (entries.size() > MAX_ENTRIES) {
            sb.append("... and ").append(entries.size() - MAX_ENTRIES).append(" more\n");
        }
        return ToolResult.success(sb.toString(), Map.of("count", entries.size()));
    }
}
