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
import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.model.ExecutionEvent;
import me.golemcore.agent.domain.model.ExecutionEventType;
import me.golemcore.agent.domain.model.ExecutionPhase;
import me.golemcore.agent.domain.model.ExecutionSnapshot;
import me.golemcore.agent.domain.model.ExecutionStats;
import me.golemcore.agent.domain.model.ToolCallStatus;
import me.golemcore.agent.domain.model.ToolCallSummary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process publish/subscribe bus for one session's execution events.
 *
 * <p>
 * Events are delivered synchronously to every listener in subscription order.
 * A listener that throws is logged and skipped; the rest still receive the
 * event. Each event is also folded into an aggregate state which
 * {@link #getSnapshot()} returns as an immutable copy. Past events are not
 * replayed to new listeners.
 *
 * <p>
 * Safe to use from the parallel tool executor threads: state changes and
 * delivery of one event happen atomically with respect to other events.
 */
@Slf4j
public class ExecutionStreamManager {

    private final String sessionId;
    private final Clock clock;
    private final List<ListenerRegistration> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    // Aggregate state, guarded by lock
    private ExecutionPhase phase = ExecutionPhase.IDLE;
    private ExecutionStats stats = ExecutionStats.builder().build();
    private Instant finishedAt;
    private String currentToolCallId;
    private final Map<String, ToolCallSummary> toolCalls = new LinkedHashMap<>();
    private final StringBuilder thinking = new StringBuilder();
    private final StringBuilder streamingContent = new StringBuilder();
    private String error;

    public ExecutionStreamManager(String sessionId, Clock clock) {
        this.sessionId = sessionId;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ==================== SUBSCRIPTION ====================

    public Subscription on(ExecutionEventListener listener) {
        ListenerRegistration registration = new ListenerRegistration(Objects.requireNonNull(listener));
        listeners.add(registration);
        return registration;
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void removeAllListeners() {
        listeners.clear();
    }

    // ==================== EMISSION ====================

    public ExecutionEvent emit(ExecutionEventType type, Map<String, Object> payload) {
        ExecutionEvent event = ExecutionEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .sessionId(sessionId)
                .payload(payload != null ? new LinkedHashMap<>(payload) : Map.of())
                .build();
        emit(event);
        return event;
    }

    public void emit(ExecutionEvent event) {
        synchronized (lock) {
            apply(event);
            for (ListenerRegistration registration : listeners) {
                try {
                    registration.listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("[ExecutionStream] Listener failed on {}: {}", event.type().getId(), e.getMessage(), e);
                }
            }
        }
    }

    // ==================== EXECUTION LIFECYCLE ====================

    public void start() {
        emit(ExecutionEventType.EXECUTION_START, Map.of());
    }

    /**
     * Marks the execution completed. The event carries the cumulative stats and
     * the cost of this execution.
     */
    public void complete(double costDelta) {
        ExecutionStats current = getSnapshot().stats();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventPayload.INPUT_TOKENS, current.getInputTokens());
        payload.put(EventPayload.OUTPUT_TOKENS, current.getOutputTokens());
        payload.put(EventPayload.TOTAL_TOKENS, current.getTotalTokens());
        payload.put(EventPayload.TOOL_CALL_COUNT, current.getToolCallCount());
        payload.put(EventPayload.LOOP_COUNT, current.getLoopCount());
        payload.put(EventPayload.ELAPSED_MS, current.getElapsedMs());
        payload.put(EventPayload.COST, costDelta);
        emit(ExecutionEventType.EXECUTION_COMPLETE, payload);
    }

    public void cancel(String reason) {
        emit(ExecutionEventType.EXECUTION_CANCEL, mapOf(EventPayload.REASON, reason));
    }

    public void error(String message) {
        emit(ExecutionEventType.EXECUTION_ERROR, mapOf(EventPayload.ERROR, message));
    }

    // ==================== THINKING ====================

    public void startThinking() {
        emit(ExecutionEventType.THINKING_START, Map.of());
    }

    public void appendThinking(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        emit(ExecutionEventType.THINKING_DELTA, mapOf(EventPayload.DELTA, delta));
    }

    public void completeThinking(String content) {
        emit(ExecutionEventType.THINKING_COMPLETE, mapOf(EventPayload.CONTENT, content));
    }

    /**
     * Appends streamed answer text. Snapshot-only, no event.
     */
    public void appendStreamingContent(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        synchronized (lock) {
            phase = ExecutionPhase.STREAMING;
            streamingContent.append(delta);
        }
    }

    // ==================== TOOL CALLS ====================

    public void toolValidating(String callId, String toolName, String category, String paramsSummary,
            String thinkingContent) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        payload.put(EventPayload.CATEGORY, category);
        payload.put(EventPayload.PARAMS_SUMMARY, paramsSummary);
        if (thinkingContent != null && !thinkingContent.isBlank()) {
            payload.put(EventPayload.THINKING, thinkingContent);
        }
        emit(ExecutionEventType.TOOL_VALIDATING, payload);
    }

    public void toolAwaitingApproval(String callId, String toolName, ConfirmDetails details) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        if (details != null) {
            payload.put(EventPayload.DETAILS, details);
        }
        emit(ExecutionEventType.TOOL_AWAITING_APPROVAL, payload);
    }

    public void toolExecuting(String callId, String toolName) {
        emit(ExecutionEventType.TOOL_EXECUTING, toolPayload(callId, toolName));
    }

    public void toolComplete(String callId, String toolName, String resultSummary, long durationMs) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        payload.put(EventPayload.RESULT, resultSummary);
        payload.put(EventPayload.DURATION_MS, durationMs);
        emit(ExecutionEventType.TOOL_COMPLETE, payload);
    }

    /**
     * @param exceptional
     *            true when the tool threw, false for a failure the tool itself
     *            reported
     */
    public void toolError(String callId, String toolName, String errorMessage, boolean exceptional,
            long durationMs) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        payload.put(EventPayload.ERROR, errorMessage);
        payload.put(EventPayload.EXCEPTIONAL, exceptional);
        payload.put(EventPayload.DURATION_MS, durationMs);
        emit(ExecutionEventType.TOOL_ERROR, payload);
    }

    public void toolCancelled(String callId, String toolName, String reason) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        payload.put(EventPayload.REASON, reason);
        emit(ExecutionEventType.TOOL_CANCELLED, payload);
    }

    public void toolProgress(String callId, String toolName, ToolCallSummary.SubToolProgress progress) {
        Map<String, Object> payload = toolPayload(callId, toolName);
        payload.put(EventPayload.SUB_TOOL_CALL, progress);
        emit(ExecutionEventType.TOOL_PROGRESS, payload);
    }

    // ==================== COMPRESSION ====================

    public void compressionStart(String trigger, int messageCount, int tokens) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventPayload.TRIGGER, trigger);
        payload.put(EventPayload.MESSAGE_COUNT, messageCount);
        payload.put(EventPayload.ORIGINAL_TOKENS, tokens);
        emit(ExecutionEventType.COMPRESSION_START, payload);
    }

    public void compressionComplete(CompressionResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventPayload.COMPRESSED, result.compressed());
        payload.put(EventPayload.MESSAGE_COUNT, result.compressedCount());
        payload.put(EventPayload.ORIGINAL_TOKENS, result.originalTokens());
        payload.put(EventPayload.COMPRESSED_TOKENS, result.compressedTokens());
        payload.put(EventPayload.SAVED_PERCENTAGE, result.savedPercentage());
        emit(ExecutionEventType.COMPRESSION_COMPLETE, payload);
    }

    // ==================== STATS ====================

    public void updateStats(long inputTokens, long outputTokens, double cost) {
        synchronized (lock) {
            stats.setInputTokens(stats.getInputTokens() + inputTokens);
            stats.setOutputTokens(stats.getOutputTokens() + outputTokens);
            stats.setTotalTokens(stats.getInputTokens() + stats.getOutputTokens());
            stats.setCost(stats.getCost() + cost);
        }
    }

    public void incrementLoopCount() {
        synchronized (lock) {
            stats.setLoopCount(stats.getLoopCount() + 1);
        }
    }

    // ==================== SNAPSHOT ====================

    public ExecutionSnapshot getSnapshot() {
        synchronized (lock) {
            ExecutionStats statsCopy = stats.toBuilder().build();
            if (statsCopy.getStartTime() != null) {
                Instant end = finishedAt != null ? finishedAt : clock.instant();
                statsCopy.setElapsedMs(Duration.between(statsCopy.getStartTime(), end).toMillis());
            }
            List<ToolCallSummary> history = new ArrayList<>(toolCalls.size());
            for (ToolCallSummary summary : toolCalls.values()) {
                history.add(copy(summary));
            }
            ToolCallSummary current = currentToolCallId != null ? toolCalls.get(currentToolCallId) : null;
            return ExecutionSnapshot.builder()
                    .phase(phase)
                    .stats(statsCopy)
                    .currentToolCall(current != null ? copy(current) : null)
                    .toolCallHistory(List.copyOf(history))
                    .thinking(thinking.length() > 0 ? thinking.toString() : null)
                    .streamingContent(streamingContent.length() > 0 ? streamingContent.toString() : null)
                    .error(error)
                    .build();
        }
    }

    public ExecutionPhase getPhase() {
        synchronized (lock) {
            return phase;
        }
    }

    // ==================== STATE FOLDING ====================

    private void apply(ExecutionEvent event) {
        Instant now = event.timestamp();
        switch (event.type()) {
        case EXECUTION_START -> {
            phase = ExecutionPhase.THINKING;
            stats = ExecutionStats.builder().startTime(now).build();
            finishedAt = null;
            currentToolCallId = null;
            toolCalls.clear();
            thinking.setLength(0);
            streamingContent.setLength(0);
            error = null;
        }
        case EXECUTION_COMPLETE -> {
            phase = ExecutionPhase.COMPLETED;
            finishedAt = now;
            currentToolCallId = null;
        }
        case EXECUTION_ERROR -> {
            phase = ExecutionPhase.ERROR;
            finishedAt = now;
            error = event.getString(EventPayload.ERROR);
        }
        case EXECUTION_CANCEL -> {
            phase = ExecutionPhase.CANCELLED;
            finishedAt = now;
            for (ToolCallSummary summary : toolCalls.values()) {
                if (summary.getStatus() != null && !summary.getStatus().isTerminal()) {
                    summary.setStatus(ToolCallStatus.CANCELLED);
                }
            }
            currentToolCallId = null;
        }
        case THINKING_START -> {
            phase = ExecutionPhase.THINKING;
            thinking.setLength(0);
        }
        case THINKING_DELTA -> thinking.append(event.getString(EventPayload.DELTA));
        case THINKING_COMPLETE -> {
            String content = event.getString(EventPayload.CONTENT);
            if (content != null && !content.isEmpty()) {
                thinking.setLength(0);
                thinking.append(content);
            }
        }
        case TOOL_VALIDATING -> {
            String callId = event.getString(EventPayload.CALL_ID);
            toolCalls.put(callId, ToolCallSummary.builder()
                    .callId(callId)
                    .toolName(event.getString(EventPayload.TOOL_NAME))
                    .category(event.getString(EventPayload.CATEGORY))
                    .paramsSummary(event.getString(EventPayload.PARAMS_SUMMARY))
                    .thinking(event.getString(EventPayload.THINKING))
                    .status(ToolCallStatus.VALIDATING)
                    .startTime(now)
                    .build());
            stats.setToolCallCount(stats.getToolCallCount() + 1);
            currentToolCallId = callId;
        }
        case TOOL_AWAITING_APPROVAL -> {
            updateTool(event, ToolCallStatus.AWAITING_APPROVAL);
            phase = ExecutionPhase.WAITING_CONFIRM;
        }
        case TOOL_EXECUTING -> {
            updateTool(event, ToolCallStatus.EXECUTING);
            phase = ExecutionPhase.TOOL_EXECUTING;
            currentToolCallId = event.getString(EventPayload.CALL_ID);
        }
        case TOOL_COMPLETE -> {
            ToolCallSummary summary = updateTool(event, ToolCallStatus.SUCCESS);
            if (summary != null) {
                summary.setResultSummary(event.getString(EventPayload.RESULT));
            }
            finishTool(event);
        }
        case TOOL_ERROR -> {
            ToolCallSummary summary = updateTool(event, ToolCallStatus.ERROR);
            if (summary != null) {
                summary.setError(event.getString(EventPayload.ERROR));
            }
            finishTool(event);
        }
        case TOOL_CANCELLED -> {
            ToolCallSummary summary = updateTool(event, ToolCallStatus.CANCELLED);
            if (summary != null) {
                summary.setError(event.getString(EventPayload.REASON));
            }
            finishTool(event);
        }
        case TOOL_PROGRESS -> {
            ToolCallSummary summary = toolCalls.get(event.getString(EventPayload.CALL_ID));
            if (summary != null && event.get(EventPayload.SUB_TOOL_CALL) instanceof ToolCallSummary.SubToolProgress p) {
                summary.getSubToolCalls().removeIf(existing -> Objects.equals(existing.subToolCallId(),
                        p.subToolCallId()));
                summary.getSubToolCalls().add(p);
            }
        }
        case COMPRESSION_START, COMPRESSION_COMPLETE -> {
            // no aggregate state
        }
        default -> log.debug("[ExecutionStream] Unhandled event type {}", event.type());
        }
    }

    private ToolCallSummary updateTool(ExecutionEvent event, ToolCallStatus status) {
        ToolCallSummary summary = toolCalls.get(event.getString(EventPayload.CALL_ID));
        if (summary != null) {
            summary.setStatus(status);
        }
        return summary;
    }

    private void finishTool(ExecutionEvent event) {
        String callId = event.getString(EventPayload.CALL_ID);
        ToolCallSummary summary = toolCalls.get(callId);
        if (summary != null) {
            Object duration = event.get(EventPayload.DURATION_MS);
            if (duration instanceof Number n) {
                summary.setDurationMs(n.longValue());
            } else if (summary.getStartTime() != null) {
                summary.setDurationMs(Duration.between(summary.getStartTime(), event.timestamp()).toMillis());
            }
        }
        if (Objects.equals(currentToolCallId, callId)) {
            currentToolCallId = null;
        }
    }

    private static ToolCallSummary copy(ToolCallSummary summary) {
        return summary.toBuilder().subToolCalls(new ArrayList<>(summary.getSubToolCalls())).build();
    }

    private static Map<String, Object> toolPayload(String callId, String toolName) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventPayload.CALL_ID, callId);
        payload.put(EventPayload.TOOL_NAME, toolName);
        return payload;
    }

    private static Map<String, Object> mapOf(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return payload;
    }

    private final class ListenerRegistration implements Subscription {

        private final ExecutionEventListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ListenerRegistration(ExecutionEventListener listener) {
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
