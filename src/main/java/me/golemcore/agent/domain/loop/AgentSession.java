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

package me.golemcore.agent.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.context.ContextManager;
import me.golemcore.agent.domain.exception.SessionPersistenceException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.AgentRunResult;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import me.golemcore.agent.domain.tool.CancellationSignal;
import me.golemcore.agent.domain.tool.ToolScheduler;
import me.golemcore.agent.port.outbound.SessionStorePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned handle on one conversation. Wires the context, scheduler, event
 * stream and loop of a single session, runs turns one at a time and persists
 * the raw message log after every turn.
 *
 * <p>
 * Lifecycle: {@link #init()} once, any number of {@link #run(String)} calls,
 * then {@link #dispose()}. {@link #abort(String)} may be called from any
 * thread while a turn is running.
 */
@Slf4j
public class AgentSession {

    private final String sessionId;
    private final ContextManager context;
    private final ToolScheduler scheduler;
    private final ExecutionStreamManager stream;
    private final AgentLoop loop;
    private final SessionStorePort sessionStore;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Message> persistedMessages = new ArrayList<>();
    private volatile CancellationSignal currentSignal;
    private volatile boolean disposed;

    public AgentSession(String sessionId, ContextManager context, ToolScheduler scheduler,
            ExecutionStreamManager stream, AgentLoop loop, SessionStorePort sessionStore) {
        this.sessionId = sessionId;
        this.context = context;
        this.scheduler = scheduler;
        this.stream = stream;
        this.loop = loop;
        this.sessionStore = sessionStore;
    }

    /**
     * Restores stored state. With a checkpoint, history becomes the summary
     * plus every message after the checkpoint's anchor; if the anchor is gone
     * the checkpoint is dropped and the full log is loaded instead.
     */
    public void init() {
        Optional<SessionData> stored = sessionStore.loadSessionData(sessionId);
        if (stored.isEmpty()) {
            log.debug("[Session] No stored data for {}, starting fresh", sessionId);
            return;
        }

        SessionData data = stored.get();
        List<Message> messages = data.getMessages() != null ? data.getMessages() : List.of();
        persistedMessages.clear();
        persistedMessages.addAll(messages);

        SessionCheckpoint checkpoint = data.getCheckpoint();
        if (checkpoint == null) {
            context.loadHistory(messages);
            log.info("[Session] Resumed {} with {} messages", sessionId, messages.size());
            return;
        }

        int anchor = indexOf(messages, checkpoint.getLoadAfterMessageId());
        if (anchor < 0) {
            log.warn("[Session] Checkpoint anchor {} not found in {}, discarding checkpoint",
                    checkpoint.getLoadAfterMessageId(), sessionId);
            sessionStore.deleteCheckpoint(sessionId);
            context.loadHistory(messages);
            return;
        }

        List<Message> tail = new ArrayList<>(messages.subList(anchor + 1, messages.size()));
        context.loadWithSummary(checkpoint.getSummary(), tail);
        context.setCumulativeStats(checkpoint.getStats());
        log.info("[Session] Resumed {} from checkpoint ({} messages after summary)", sessionId, tail.size());
    }

    /**
     * Runs one user turn to a terminal state. Blocks the calling thread.
     *
     * @throws IllegalStateException
     *             if a turn is already running or the session is disposed
     */
    public AgentRunResult run(String input) {
        if (disposed) {
            throw new IllegalStateException("Session " + sessionId + " is disposed");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + sessionId + " is already running a turn");
        }
        CancellationSignal signal = new CancellationSignal();
        currentSignal = signal;
        try {
            scheduler.clearRecords();
            stream.start();
            context.setUserInput(input);

            AgentRunResult result;
            try {
                result = loop.execute(signal);
            } catch (RuntimeException e) {
                log.error("[Session] Unexpected failure in turn", e);
                result = AgentRunResult.failed(AgentRunResult.FailureKind.INTERNAL, e.getMessage(), 0);
            }
            return conclude(result, signal);
        } finally {
            currentSignal = null;
            running.set(false);
        }
    }

    /**
     * Cancels the running turn, if any. Running tools observe the signal and
     * in-flight calls end as cancelled.
     */
    public void abort(String reason) {
        CancellationSignal signal = currentSignal;
        if (signal != null) {
            log.info("[Session] Aborting turn in {}: {}", sessionId, reason);
            signal.cancel(reason != null ? reason : "Execution aborted");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Compresses history on demand and writes a checkpoint.
     *
     * @throws IllegalStateException
     *             while a turn is running
     */
    public CompressionResult compress() {
        if (running.get()) {
            throw new IllegalStateException("Cannot compress while a turn is running");
        }
        return context.forceCompress();
    }

    public void dispose() {
        abort("Session disposed");
        stream.removeAllListeners();
        scheduler.clearRecords();
        disposed = true;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ContextManager getContext() {
        return context;
    }

    public ExecutionStreamManager getStream() {
        return stream;
    }

    public ToolScheduler getScheduler() {
        return scheduler;
    }

    public ApprovalMode getApprovalMode() {
        return scheduler.getApprovalMode();
    }

    public void setApprovalMode(ApprovalMode approvalMode) {
        scheduler.setApprovalMode(approvalMode);
    }

    public List<Message> getPersistedMessages() {
        return Collections.unmodifiableList(persistedMessages);
    }

    private AgentRunResult conclude(AgentRunResult result, CancellationSignal signal) {
        List<Message> archived = result.status() == AgentRunResult.Status.COMPLETED
                ? context.finishTurn()
                : context.cancelTurn();
        try {
            persist(archived);
        } catch (SessionPersistenceException e) {
            log.error("[Session] Failed to persist turn of {}", sessionId, e);
            stream.error(e.getMessage());
            return new AgentRunResult(AgentRunResult.Status.FAILED, result.content(),
                    AgentRunResult.FailureKind.PERSISTENCE_FAILURE, e.getMessage(), result.loopCount(),
                    result.inputTokens(), result.outputTokens(), result.cost());
        }

        switch (result.status()) {
        case COMPLETED -> stream.complete(result.cost());
        case CANCELLED -> stream.cancel(signal.getReason() != null ? signal.getReason() : "Execution aborted");
        case FAILED -> stream.error(result.error());
        default -> throw new IllegalStateException("Unexpected status: " + result.status());
        }
        return result;
    }

    private void persist(List<Message> archived) {
        persistedMessages.addAll(archived);
        sessionStore.saveMessages(sessionId, new ArrayList<>(persistedMessages));
    }

    private static int indexOf(List<Message> messages, String messageId) {
        if (messageId == null) {
            return -1;
        }
        for (int i = 0; i < messages.size(); i++) {
            if (messageId.equals(messages.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
