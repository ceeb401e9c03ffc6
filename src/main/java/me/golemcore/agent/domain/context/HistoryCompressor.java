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
import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the older part of a conversation with an LLM-written summary while
 * keeping the most recent messages verbatim.
 *
 * <p>
 * The split point is chosen so that the preserved tail holds roughly
 * {@code preserveRatio} of the history's tokens, then moved back until it no
 * longer cuts through a tool call unit. Any failure leaves the history as it
 * was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryCompressor {

    static final int MIN_MESSAGES_TO_COMPRESS = 4;
    static final int MIN_SPLIT_POINT = 2;
    static final int MAX_MESSAGE_CHARS = 2000;
    static final String TRUNCATION_MARKER = "... [truncated]";
    static final String SUMMARY_PREFIX = "[Conversation summary]\n";
    private static final String MESSAGE_SEPARATOR = "\n\n---\n\n";
    private static final int MAX_SUMMARY_TOKENS = 2000;
    private static final Pattern SUMMARY_PATTERN = Pattern.compile("<summary>(.*?)</summary>", Pattern.DOTALL);

    private static final String COMPRESSION_PROMPT = """
            You compress the history of a coding session so the work can continue without it.
            Read the conversation and write a summary that keeps:
            - the user's goals, requests and constraints
            - what has been done so far, including files read or changed and commands run
            - key results, errors and decisions
            - the current state of the task and the next steps

            Keep file paths, identifiers and numbers exact. Do not invent anything.
            Write in the language the conversation uses.
            Wrap the summary in <summary></summary> tags and output nothing else.""";

    private final LlmPort llmPort;
    private final AgentProperties properties;
    private final Clock clock;

    public CompressionResult compress(List<Message> history, double preserveRatio) {
        if (history == null || history.size() < MIN_MESSAGES_TO_COMPRESS) {
            return CompressionResult.notCompressed(history, TokenEstimator.estimateMessages(history));
        }

        int originalTokens = TokenEstimator.estimateMessages(history);
        int splitPoint = findSplitPoint(history, preserveRatio);
        if (splitPoint < MIN_SPLIT_POINT) {
            log.debug("[Compressor] Split point {} too early, nothing to compress", splitPoint);
            return CompressionResult.notCompressed(history, originalTokens);
        }

        List<Message> toCompress = history.subList(0, splitPoint);
        List<Message> preserved = history.subList(splitPoint, history.size());

        String summary;
        try {
            summary = summarize(toCompress);
        } catch (RuntimeException e) {
            log.warn("[Compressor] Summarization failed, keeping full history: {}", e.getMessage());
            return CompressionResult.notCompressed(history, originalTokens);
        }
        if (summary == null || summary.isBlank()) {
            return CompressionResult.notCompressed(history, originalTokens);
        }

        List<Message> compressed = new ArrayList<>(preserved.size() + 1);
        compressed.add(createSummaryMessage(summary));
        compressed.addAll(MessageSanitizer.sanitize(preserved).messages());

        int compressedTokens = TokenEstimator.estimateMessages(compressed);
        log.info("[Compressor] Compressed {} messages into summary, kept {} ({} -> {} tokens)",
                toCompress.size(), preserved.size(), originalTokens, compressedTokens);

        return CompressionResult.builder()
                .compressed(true)
                .messages(compressed)
                .originalCount(history.size())
                .compressedCount(compressed.size())
                .originalTokens(originalTokens)
                .compressedTokens(compressedTokens)
                .summary(summary)
                .lastCompressedMessageId(toCompress.get(toCompress.size() - 1).getId())
                .build();
    }

    /**
     * Index of the first preserved message. Everything before it is summarized.
     */
    int findSplitPoint(List<Message> history, double preserveRatio) {
        int totalTokens = TokenEstimator.estimateMessages(history);
        double target = totalTokens * preserveRatio;

        int accumulated = 0;
        int splitPoint = history.size();
        for (int i = history.size() - 1; i >= 0; i--) {
            accumulated += TokenEstimator.estimateMessage(history.get(i));
            splitPoint = i;
            if (accumulated >= target) {
                break;
            }
        }

        while (splitPoint > 0
                && (history.get(splitPoint).isToolMessage() || history.get(splitPoint - 1).hasToolCalls())) {
            splitPoint--;
        }
        return splitPoint;
    }

    Message createSummaryMessage(String summary) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_SYSTEM)
                .content(SUMMARY_PREFIX + summary)
                .timestamp(clock.instant())
                .build();
    }

    private String summarize(List<Message> messages) {
        if (!llmPort.isAvailable()) {
            log.warn("[Compressor] LLM not available, cannot summarize");
            return null;
        }

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(COMPRESSION_PROMPT)
                .messages(List.of(Message.user(formatMessages(messages))))
                .maxTokens(MAX_SUMMARY_TOKENS)
                .temperature(0.3)
                .build();

        long timeoutMs = properties.getContext().getSummaryTimeoutMs();
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            long start = clock.millis();
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            String summary = extractSummary(response != null ? response.getContent() : null);
            if (summary == null || summary.isBlank()) {
                log.warn("[Compressor] LLM returned empty summary");
                return null;
            }
            log.debug("[Compressor] Summarized {} messages in {}ms", messages.size(), clock.millis() - start);
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compressor] Summarization interrupted: {}", e.getMessage());
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Compressor] Summarization timed out after {}ms", timeoutMs);
            return null;
        } catch (ExecutionException e) {
            log.warn("[Compressor] Summarization failed: {}", e.getMessage());
            return null;
        }
    }

    static String formatMessages(List<Message> messages) {
        List<String> parts = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            StringBuilder sb = new StringBuilder();
            sb.append('[').append(i + 1).append("] ").append(roleLabel(message)).append(":\n");
            sb.append(truncate(message.getContent()));
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    sb.append("\n-> ").append(call.getName()).append(' ')
                            .append(truncate(call.getArguments()));
                }
            }
            parts.add(sb.toString());
        }
        return String.join(MESSAGE_SEPARATOR, parts);
    }

    static String extractSummary(String response) {
        if (response == null) {
            return null;
        }
        Matcher matcher = SUMMARY_PATTERN.matcher(response);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return response.trim();
    }

    private static String roleLabel(Message message) {
        if (message.getRole() == null) {
            return "Unknown";
        }
        return switch (message.getRole()) {
        case Message.ROLE_USER -> "User";
        case Message.ROLE_ASSISTANT -> "Assistant";
        case Message.ROLE_SYSTEM -> "System";
        case Message.ROLE_TOOL -> "Tool result" + (message.getName() != null ? " (" + message.getName() + ")" : "");
        default -> message.getRole();
        };
    }

    private static String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= MAX_MESSAGE_CHARS) {
            return content;
        }
        return content.substring(0, MAX_MESSAGE_CHARS) + TRUNCATION_MARKER;
    }
}
