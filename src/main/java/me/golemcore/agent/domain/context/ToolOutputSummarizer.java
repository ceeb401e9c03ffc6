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

package me.golemcore.agent.domain.context;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolOutputProcessResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shrinks oversized tool output before it goes back to the model. Output
 * beyond {@link #MAX_OUTPUT_CHARS} is first cut to its head and tail lines;
 * output above the token threshold is summarized by the LLM, falling back to
 * truncation when that fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolOutputSummarizer {

    static final int MAX_OUTPUT_CHARS = 100_000;
    static final int TRUNCATE_LINES = 1000;
    static final int MAX_SUMMARY_TOKENS = 1500;

    private static final String SUMMARY_PROMPT = """
            Summarize the output of a tool call for an AI coding agent.
            Keep everything the agent needs to continue: file paths, line numbers, identifiers,
            error messages, counts and exact values. Drop repetition and boilerplate.
            Output only the summary.""";

    private final LlmPort llmPort;
    private final AgentProperties properties;

    public boolean needsSummary(String output, int thresholdTokens) {
        return TokenEstimator.estimate(output) > thresholdTokens;
    }

    public boolean needsTruncation(String output) {
        return output != null && output.length() > MAX_OUTPUT_CHARS;
    }

    public ToolOutputProcessResult process(String output, String toolName, int thresholdTokens) {
        int originalTokens = TokenEstimator.estimate(output);
        if (output == null) {
            return new ToolOutputProcessResult(null, false, false, 0, 0);
        }

        if (needsTruncation(output)) {
            String summary = summarize(truncate(output, TRUNCATE_LINES), toolName);
            return new ToolOutputProcessResult(summary, true, true, originalTokens, TokenEstimator.estimate(summary));
        }
        if (needsSummary(output, thresholdTokens)) {
            String summary = summarize(output, toolName);
            return new ToolOutputProcessResult(summary, true, false, originalTokens, TokenEstimator.estimate(summary));
        }
        return new ToolOutputProcessResult(output, false, false, originalTokens, originalTokens);
    }

    /**
     * Summarizes via the LLM; on any failure returns the truncated output
     * instead.
     */
    public String summarize(String output, String toolName) {
        if (!llmPort.isAvailable()) {
            return truncate(output, TRUNCATE_LINES);
        }

        String header = toolName != null ? "Tool: " + toolName + "\n\n" : "";
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SUMMARY_PROMPT)
                .messages(List.of(Message.user(header + output)))
                .maxTokens(MAX_SUMMARY_TOKENS)
                .temperature(0.2)
                .build();

        long timeoutMs = properties.getContext().getSummaryTimeoutMs();
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            String summary = response != null ? response.getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[ToolOutput] Empty summary for {}, truncating instead", toolName);
                return truncate(output, TRUNCATE_LINES);
            }
            // Providers do not always honour maxTokens
            summary = quickTruncate(summary, MAX_SUMMARY_TOKENS);
            log.debug("[ToolOutput] Summarized {} output: {} -> {} tokens", toolName,
                    TokenEstimator.estimate(output), TokenEstimator.estimate(summary));
            return "[Tool output summary" + (toolName != null ? " - " + toolName : "") + "]\n" + summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ToolOutput] Summarization interrupted for {}", toolName);
            return truncate(output, TRUNCATE_LINES);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ToolOutput] Summarization timed out for {}, truncating", toolName);
            return truncate(output, TRUNCATE_LINES);
        } catch (ExecutionException e) {
            log.warn("[ToolOutput] Summarization failed for {}: {}", toolName, e.getMessage());
            return truncate(output, TRUNCATE_LINES);
        }
    }

    /**
     * Keeps the first and last {@code maxLines / 2} lines. Output with few but
     * very long lines is cut by characters instead.
     */
    public static String truncate(String output, int maxLines) {
        String[] lines = output.split("\n", -1);
        if (lines.length <= maxLines) {
            if (output.length() <= MAX_OUTPUT_CHARS) {
                return output;
            }
            int half = MAX_OUTPUT_CHARS / 2 - 50;
            int omitted = output.length() - half * 2;
            return output.substring(0, half) + "\n\n... [truncated, " + omitted + " characters omitted] ...\n\n"
                    + output.substring(output.length() - half);
        }

        int halfLines = maxLines / 2;
        int omittedLines = lines.length - halfLines * 2;
        String head = String.join("\n", Arrays.copyOfRange(lines, 0, halfLines));
        String tail = String.join("\n", Arrays.copyOfRange(lines, lines.length - halfLines, lines.length));
        return head + "\n\n... [truncated, " + omittedLines + " lines omitted] ...\n\n" + tail;
    }

    /**
     * Cheap head/tail cut to roughly {@code maxTokens} without calling the LLM.
     */
    public static String quickTruncate(String output, int maxTokens) {
        if (output == null || TokenEstimator.estimate(output) <= maxTokens) {
            return output;
        }
        int halfChars = Math.max(0, maxTokens * 4 / 2 - 50);
        if (halfChars * 2 >= output.length()) {
            return output;
        }
        return output.substring(0, halfChars) + "\n\n... [truncated] ...\n\n"
                + output.substring(output.length() - halfChars);
    }
}
