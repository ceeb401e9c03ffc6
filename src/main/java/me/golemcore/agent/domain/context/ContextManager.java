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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ContextOverflowException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.ContextThresholds;
import me.golemcore.agent.domain.model.ContextUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.OverflowCheck;
import me.golemcore.agent.domain.model.SanitizeResult;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.port.outbound.SessionStorePort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Owns the conversation state of one session: system prompt, archived history,
 * the pending user input and the messages of the turn in progress.
 *
 * <p>
 * The list handed to the model is always assembled as
 * {@code [system] + history + [user input] + current turn} and then sanitized.
 * Messages move from the current turn into history only through
 * {@link #finishTurn()} or {@link #cancelTurn()}.
 *
 * <p>
 * Not thread-safe. All access must stay on the session's agent loop.
 */
@Slf4j
public class ContextManager {

    static final String RESUMED_SUMMARY_PREFIX = "[Previous conversation summary]\n";

    private final String sessionId;
    private final ContextChecker checker;
    private final HistoryCompressor compressor;
    private final SessionStorePort sessionStore;
    private final ExecutionStreamManager stream;
    private final Clock clock;

    private String systemPrompt;
    private List<Message> history = new ArrayList<>();
    private Message pendingInput;
    private final List<Message> currentTurn = new ArrayList<>();
    private SessionCheckpoint.Stats cumulativeStats = new SessionCheckpoint.Stats();

    public ContextManager(String sessionId, String systemPrompt, ContextChecker checker, HistoryCompressor compressor,
            SessionStorePort sessionStore, ExecutionStreamManager stream, Clock clock) {
        this.sessionId = sessionId;
        this.systemPrompt = systemPrompt;
        this.checker = checker;
        this.compressor = compressor;
        this.sessionStore = sessionStore;
        this.stream = stream;
        this.clock = clock;
    }

    // ==================== INPUT ====================

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public Message setUserInput(String input) {
        this.pendingInput = stamp(Message.user(input));
        return pendingInput;
    }

    public Message getPendingInput() {
        return pendingInput;
    }

    public Message addToCurrentTurn(Message message) {
        Message stamped = stamp(message);
        currentTurn.add(stamped);
        return stamped;
    }

    public List<Message> getCurrentTurn() {
        return Collections.unmodifiableList(currentTurn);
    }

    public List<Message> getHistory() {
        return Collections.unmodifiableList(history);
    }

    // ==================== ASSEMBLY ====================

    /**
     * Builds the sanitized message list for the next model call, compressing
     * history first when usage crosses the compression trigger.
     */
    public List<Message> getContext(boolean autoCompress) {
        if (autoCompress && checker.checkCompression(assemble()).needed()) {
            log.info("[Context] Usage above compression trigger ({}), compressing history", getUsage().formatted());
            compressHistory("auto");
        }
        return sanitizedContext();
    }

    public boolean isOverflow() {
        return !checkOverflow().passed();
    }

    public OverflowCheck checkOverflow() {
        return checker.checkOverflow(sanitizedContext());
    }

    /**
     * @throws ContextOverflowException
     *             when the context is above the overflow threshold
     */
    public void ensureWithinBudget() {
        OverflowCheck check = checkOverflow();
        if (!check.passed()) {
            throw new ContextOverflowException(check);
        }
    }

    public ContextUsage getUsage() {
        return checker.getUsage(sanitizedContext());
    }

    public void updateTokenCount(int promptTokens) {
        checker.updateTokenCount(promptTokens);
    }

    // ==================== TURN BOUNDARIES ====================

    /**
     * Archives the pending input and the current turn into history.
     *
     * @return the archived messages, in order
     */
    public List<Message> finishTurn() {
        List<Message> archived = new ArrayList<>(currentTurn.size() + 1);
        if (pendingInput != null) {
            archived.add(pendingInput);
        }
        archived.addAll(currentTurn);
        history.addAll(archived);
        pendingInput = null;
        currentTurn.clear();
        return archived;
    }

    /**
     * Sanitizes an interrupted turn, dropping torn tool call units, then
     * archives what is left.
     */
    public List<Message> cancelTurn() {
        SanitizeResult result = MessageSanitizer.sanitizeCurrentTurn(new ArrayList<>(currentTurn));
        if (result.sanitized()) {
            log.info("[Context] Dropped {} incomplete message(s) from cancelled turn", result.removedCount());
        }
        currentTurn.clear();
        currentTurn.addAll(result.messages());
        return finishTurn();
    }

    // ==================== HISTORY LOADING ====================

    /**
     * Replaces history wholesale. Used on resume without a checkpoint.
     */
    public void loadHistory(List<Message> messages) {
        this.history = new ArrayList<>(messages != null ? messages : List.of());
    }

    /**
     * Rebuilds history from a checkpoint as a summary message followed by the
     * verbatim tail. Does not trigger compression.
     */
    public void loadWithSummary(String summary, List<Message> tail) {
        List<Message> rebuilt = new ArrayList<>();
        rebuilt.add(stamp(Message.user(RESUMED_SUMMARY_PREFIX + summary)));
        if (tail != null) {
            rebuilt.addAll(tail);
        }
        this.history = rebuilt;
    }

    // ==================== COMPRESSION ====================

    /**
     * Compresses history regardless of usage.
     */
    public CompressionResult forceCompress() {
        return compressHistory("manual");
    }

    public void setCumulativeStats(SessionCheckpoint.Stats stats) {
        this.cumulativeStats = stats != null ? stats : new SessionCheckpoint.Stats();
    }

    public SessionCheckpoint.Stats getCumulativeStats() {
        return cumulativeStats;
    }

    public void recordUsage(long inputTokens, long outputTokens, double cost) {
        cumulativeStats.setTotalInputTokens(cumulativeStats.getTotalInputTokens() + inputTokens);
        cumulativeStats.setTotalOutputTokens(cumulativeStats.getTotalOutputTokens() + outputTokens);
        cumulativeStats.setTotalCost(cumulativeStats.getTotalCost() + cost);
    }

    public ContextThresholds getThresholds() {
        return checker.getThresholds();
    }

    private CompressionResult compressHistory(String trigger) {
        int tokens = TokenEstimator.estimateMessages(history);
        stream.compressionStart(trigger, history.size(), tokens);

        CompressionResult result = compressor.compress(history, checker.getThresholds().getCompressionPreserve());
        if (result.compressed()) {
            history = new ArrayList<>(result.messages());
            persistCheckpoint(result);
        } else {
            log.debug("[Context] Compression skipped or failed, keeping {} messages", history.size());
        }

        stream.compressionComplete(result);
        return result;
    }

    private void persistCheckpoint(CompressionResult result) {
        if (result.lastCompressedMessageId() == null) {
            log.warn("[Context] Compressed messages carry no id, checkpoint not saved");
            return;
        }
        SessionCheckpoint checkpoint = SessionCheckpoint.builder()
                .summary(result.summary())
                .loadAfterMessageId(result.lastCompressedMessageId())
                .compressedAt(clock.instant())
                .stats(SessionCheckpoint.Stats.builder()
                        .totalCost(cumulativeStats.getTotalCost())
                        .totalInputTokens(cumulativeStats.getTotalInputTokens())
                        .totalOutputTokens(cumulativeStats.getTotalOutputTokens())
                        .build())
                .build();
        sessionStore.saveCheckpoint(sessionId, checkpoint);
        log.info("[Context] Checkpoint saved for session {} after message {}", sessionId,
                result.lastCompressedMessageId());
    }

    private List<Message> assemble() {
        List<Message> messages = new ArrayList<>(history.size() + currentTurn.size() + 2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Message.system(systemPrompt));
        }
        messages.addAll(history);
        if (pendingInput != null) {
            messages.add(pendingInput);
        }
        messages.addAll(currentTurn);
        return messages;
    }

    private List<Message> sanitizedContext() {
        return MessageSanitizer.sanitize(assemble()).messages();
    }

    private Message stamp(Message message) {
        if (message.getId() != null && message.getTimestamp() != null) {
            return message;
        }
        Message.MessageBuilder builder = message.toBuilder();
        if (message.getId() == null) {
            builder.id(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            builder.timestamp(clock.instant());
        }
        return builder.build();
    }
}
