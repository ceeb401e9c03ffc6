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

package me.golemcore.agent.domain.execution;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ExecutionEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Appends a human-readable markdown trace of one session's execution events to
 * {@code <logsDir>/<sessionId>.md}. Reopening a session appends a resume marker
 * to the existing file.
 *
 * <p>
 * High-frequency events (thinking deltas, executing, progress) are not written.
 * Write failures surface as {@link UncheckedIOException}, which the stream logs
 * without affecting other listeners.
 */
@Slf4j
public class MarkdownExecutionLog implements ExecutionEventListener {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final int THINKING_EXCERPT_CHARS = 150;

    private final Path file;

    private MarkdownExecutionLog(Path file) {
        this.file = file;
    }

    /**
     * Opens the log file of a session, creating the directory and header when
     * missing.
     *
     * @throws IllegalArgumentException
     *             if the session id would escape the logs directory
     */
    public static MarkdownExecutionLog open(Path logsDir, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        Path root = logsDir.toAbsolutePath().normalize();
        Path file = root.resolve(sessionId + ".md").normalize();
        if (!root.equals(file.getParent())) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        MarkdownExecutionLog executionLog = new MarkdownExecutionLog(file);
        try {
            Files.createDirectories(root);
            if (Files.exists(file)) {
                executionLog.append("\n---\n\n_Session resumed_\n");
            } else {
                executionLog.append("# Execution log - " + sessionId + "\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open execution log: " + file, e);
        }
        log.debug("[ExecutionLog] Writing session {} to {}", sessionId, file);
        return executionLog;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        String entry = format(event);
        if (entry == null) {
            return;
        }
        try {
            append(entry);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to execution log: " + file, e);
        }
    }

    static String format(ExecutionEvent event) {
        String time = event.timestamp() != null ? TIME.format(event.timestamp()) : "--:--:--";
        String tool = event.getString(EventPayload.TOOL_NAME);
        return switch (event.type()) {
        case EXECUTION_START -> "\n## " + time + " Execution started\n";
        case EXECUTION_COMPLETE -> "\n## " + time + " Execution completed\n"
                + "- Elapsed: " + event.getString(EventPayload.ELAPSED_MS) + " ms\n"
                + "- Tool calls: " + event.getString(EventPayload.TOOL_CALL_COUNT) + "\n"
                + "- Tokens: " + event.getString(EventPayload.INPUT_TOKENS) + " in / "
                + event.getString(EventPayload.OUTPUT_TOKENS) + " out\n";
        case EXECUTION_ERROR -> "\n## " + time + " Execution failed\n- Error: " + event.getString(EventPayload.ERROR)
                + "\n";
        case EXECUTION_CANCEL -> "\n## " + time + " Execution cancelled\n"
                + line("Reason", event.getString(EventPayload.REASON));
        case THINKING_COMPLETE -> "### " + time + " Thinking\n"
                + quote(event.getString(EventPayload.CONTENT));
        case TOOL_VALIDATING -> "\n### " + time + " " + tool + "\n"
                + line("Params", event.getString(EventPayload.PARAMS_SUMMARY));
        case TOOL_AWAITING_APPROVAL -> "### " + time + " " + tool + " awaiting approval\n";
        case TOOL_COMPLETE -> "### " + time + " " + tool + " completed\n"
                + "- Duration: " + event.getString(EventPayload.DURATION_MS) + " ms\n"
                + line("Result", event.getString(EventPayload.RESULT));
        case TOOL_ERROR -> "### " + time + " " + tool + " failed\n"
                + line("Error", event.getString(EventPayload.ERROR));
        case TOOL_CANCELLED -> "### " + time + " " + tool + " cancelled\n"
                + line("Reason", event.getString(EventPayload.REASON));
        case COMPRESSION_START -> "\n### " + time + " Compression started\n"
                + "- Tokens: " + event.getString(EventPayload.ORIGINAL_TOKENS) + "\n";
        case COMPRESSION_COMPLETE -> "### " + time + " Compression completed\n"
                + "- Tokens: " + event.getString(EventPayload.ORIGINAL_TOKENS) + " -> "
                + event.getString(EventPayload.COMPRESSED_TOKENS) + " (saved "
                + event.getString(EventPayload.SAVED_PERCENTAGE) + "%)\n";
        case THINKING_START, THINKING_DELTA, TOOL_EXECUTING, TOOL_PROGRESS -> null;
        };
    }

    private static String line(String label, String value) {
        return value == null || value.isBlank() ? "" : "- " + label + ": " + value + "\n";
    }

    private static String quote(String content) {
        if (content == null || content.isBlank()) {
            return "";
        }
        String excerpt = content.length() > THINKING_EXCERPT_CHARS
                ? content.substring(0, THINKING_EXCERPT_CHARS) + "..."
                : content;
        return "> " + excerpt.replace("\n", " ") + "\n";
    }

    private synchronized void append(String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
