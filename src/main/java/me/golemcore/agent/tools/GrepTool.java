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
import me.golemcore.agent.domain.tool.CancellationSignal;
import me.golemcore.agent.domain.tool.ToolExecutionContext;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Regex search over workspace files. Uses ripgrep when it is on the PATH and
 * falls back to a Java file walk otherwise; availability is probed once.
 */
@Component
@Slf4j
public class GrepTool implements ToolComponent, ReadOnlyChecker {

    static final String NAME = "Grep";
    static final String FIELD_SEPARATOR = "|";
    static final int MAX_RESULTS = 1000;
    static final int MAX_LINE_LENGTH = 2000;
    private static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules", ".git", "dist", "build", "coverage", ".next", ".nuxt", "target");

    private final Workspace workspace;
    private final ProcessRunner processRunner;
    private final AgentProperties.ToolsProperties config;
    private volatile boolean ripgrepMissing;

    public GrepTool(Workspace workspace, ProcessRunner processRunner, AgentProperties properties) {
        this.workspace = workspace;
        this.processRunner = processRunner;
        this.config = properties.getTools();
    }

    /**
     * One matching line, path relative to the workspace.
     */
    public record GrepMatch(String filePath, int lineNumber, String line) {
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Search file contents with a regular expression. Searches directories recursively.
                        Returns matching file paths, line numbers and line text.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "pattern", ToolArguments.property("string", "Regular expression to search for"),
                                "path", ToolArguments.property("string",
                                        "Directory or file to search, relative to workspace"),
                                "include", ToolArguments.property("string",
                                        "Glob filter for file names, e.g. *.java")),
                        "required", List.of("pattern")))
                .build();
    }

    @Override
    public boolean isReadOnly() {
        return true;
    }

    @Override
    public String getCategory() {
        return "search";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> search(parameters, context.getSignal()));
    }

    private ToolResult search(Map<String, Object> parameters, CancellationSignal signal) {
        String pattern = ToolArguments.string(parameters, "pattern");
        if (pattern == null || pattern.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Missing required parameter: pattern");
        }
        String include = ToolArguments.string(parameters, "include");
        String pathStr = ToolArguments.string(parameters, "path");
        Optional<Path> target = workspace.resolve(pathStr);
        if (target.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Invalid path: must be within workspace");
        }
        if (!Files.exists(target.get())) {
            return ToolResult.failure("Path not found: " + pathStr);
        }

        List<GrepMatch> matches;
        try {
            matches = ripgrepMissing
                    ? javaSearch(pattern, target.get(), include, signal)
                    : ripgrep(pattern, target.get(), include, signal);
        } catch (PatternSyntaxException e) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid regex: " + e.getDescription());
        } catch (SearchCancelledException e) {
            return ToolResult.failure(ToolFailureKind.CANCELLED, "Search cancelled");
        } catch (SearchFailedException e) {
            return ToolResult.failure(e.getMessage());
        }

        return ToolResult.success(render(pattern, matches), Map.of("matches", matches.size()));
    }

    List<GrepMatch> ripgrep(String pattern, Path target, String include, CancellationSignal signal) {
        List<String> command = new ArrayList<>(List.of(
                config.getSearchExecutable(),
                "-nH",
                "--field-match-separator=" + FIELD_SEPARATOR,
                "--no-messages",
                "--regexp", pattern,
                "--max-count", String.valueOf(config.getSearchMaxCount())));
        if (include != null && !include.isBlank()) {
            command.add("--glob");
            command.add(include);
        }
        command.add(workspace.relativize(target));

        ProcessRunner.ProcessOutcome outcome;
        try {
            outcome = processRunner.run(command, workspace.getRoot(), null, 60, config.getMaxOutputChars(), signal);
        } catch (IOException e) {
            log.info("[Grep] {} unavailable ({}), using Java search", config.getSearchExecutable(), e.getMessage());
            ripgrepMissing = true;
            return javaSearch(pattern, target, include, signal);
        }

        if (outcome.status() == ProcessRunner.Status.CANCELLED) {
            throw new SearchCancelledException();
        }
        if (outcome.status() == ProcessRunner.Status.TIMED_OUT) {
            throw new SearchFailedException("Search timed out");
        }
        // rg exits 1 when nothing matched
        if (outcome.exitCode() == 1) {
            return List.of();
        }
        if (outcome.exitCode() != 0 && outcome.output().isBlank()) {
            throw new SearchFailedException("ripgrep failed with exit code " + outcome.exitCode());
        }
        return parseRipgrepOutput(outcome.output());
    }

    /**
     * Parses {@code path|line|text} records; text may itself contain the
     * separator.
     */
    static List<GrepMatch> parseRipgrepOutput(String output) {
        List<GrepMatch> matches = new ArrayList<>();
        for (String line : output.split("\\r?\\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(Pattern.quote(FIELD_SEPARATOR), 3);
            if (parts.length < 3) {
                continue;
            }
            int lineNumber;
            try {
                lineNumber = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                continue;
            }
            String filePath = parts[0].startsWith("./") ? parts[0].substring(2) : parts[0];
            matches.add(new GrepMatch(filePath, lineNumber, clip(parts[2])));
            if (matches.size() >= MAX_RESULTS) {
                break;
            }
        }
        return matches;
    }

    List<GrepMatch> javaSearch(String pattern, Path target, String include, CancellationSignal signal) {
        Pattern regex = Pattern.compile(pattern);
        PathMatcher matcher = include != null && !include.isBlank()
                ? FileSystems.getDefault().getPathMatcher("glob:" + include)
                : null;
        int perFileLimit = config.getSearchMaxCount();

        List<GrepMatch> matches = new ArrayList<>();
        try (Stream<Path> files = Files.walk(target)) {
            Iterator<Path> it = files
                    .filter(p -> !isExcluded(target, p))
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher == null || matcher.matches(p.getFileName()))
                    .sorted()
                    .iterator();
            while (it.hasNext() && matches.size() < MAX_RESULTS) {
                if (signal.isCancelled()) {
                    throw new SearchCancelledException();
                }
                searchFile(it.next(), regex, perFileLimit, matches);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new SearchFailedException("Search failed: " + e.getMessage());
        }
        return matches;
    }

    private void searchFile(Path file, Pattern regex, int perFileLimit, List<GrepMatch> matches) {
        String relative = workspace.relativize(file);
        int found = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            int lineNumber = 1;
            while (line != null && found < perFileLimit && matches.size() < MAX_RESULTS) {
                if (regex.matcher(line).find()) {
                    matches.add(new GrepMatch(relative, lineNumber, clip(line)));
                    found++;
                }
                line = reader.readLine();
                lineNumber++;
            }
        } catch (MalformedInputException e) {
            log.trace("[Grep] Skipping binary file {}", relative);
        } catch (IOException e) {
            log.debug("[Grep] Skipping unreadable file {}: {}", relative, e.getMessage());
        }
    }

    private static boolean isExcluded(Path root, Path path) {
        for (Path part : root.relativize(path)) {
            if (EXCLUDED_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private static String clip(String line) {
        return line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) + "..." : line;
    }

    private static String render(String pattern, List<GrepMatch> matches) {
        if (matches.isEmpty()) {
            return "No matches found for pattern: " + pattern;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(matches.size()).append(" match(es) for pattern: ").append(pattern).append("\n\n");
        for (GrepMatch match : matches) {
            sb.append(match.filePath()).append(':').append(match.lineNumber()).append(": ")
                    .append(match.line()).append('\n');
        }
        return sb.toString();
    }

    private static final class SearchCancelledException extends RuntimeException {
        private static final long serialVersionUID = 1L;
    }

    private static final class SearchFailedException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private SearchFailedException(String message) {
            super(message);
        }
    }
}
