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
import me.golemcore.agent.domain.exception.ContextOverflowException;
import me.golemcore.agent.domain.exception.LlmCallException;
import me.golemcore.agent.domain.exception.OperationCancelledException;
import me.golemcore.agent.domain.exception.SessionPersistenceException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.AgentRunResult;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SchedulerToolCallRecord;
import me.golemcore.agent.domain.model.ToolCallRequest;
import me.golemcore.agent.domain.tool.CancellationSignal;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.domain.tool.ToolScheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one user turn: context → LLM → tools → context, until the model answers
 * without tool calls, the turn is cancelled, or a turn-level failure occurs.
 *
 * <p>
 * The loop only appends to the current turn. Archiving (finish or cancel) is
 * left to the owning {@link AgentSession}, which decides based on the returned
 * {@link AgentRunResult}.
 */
@Slf4j
public class AgentLoop {

    private final ContextManager context;
    private final LlmCallExecutor llmCallExecutor;
    private final ToolScheduler scheduler;
    private final ToolRegistry registry;
    private final ExecutionStreamManager stream;
    private final LoopSettings settings;

    public AgentLoop(ContextManager context, LlmCallExecutor llmCallExecutor, ToolScheduler scheduler,
            ToolRegistry registry, ExecutionStreamManager stream, LoopSettings settings) {
        this.context = context;
        this.llmCallExecutor = llmCallExecutor;
        this.scheduler = scheduler;
        this.registry = registry;
        this.stream = stream;
        this.settings = settings;
    }

    public AgentRunResult execute(CancellationSignal signal) {
        TurnTotals totals = new TurnTotals();
        try {
            while (true) {
                if (signal.isCancelled()) {
                    return cancelled(totals);
                }
                if (totals.loops >= settings.maxLoops()) {
                    log.warn("[Loop] Reached max loops ({})", settings.maxLoops());
                    return withTotals(AgentRunResult.failed(AgentRunResult.FailureKind.MAX_LOOPS,
                            "Reached maximum of " + settings.maxLoops() + " model calls in one turn", totals.loops),
                            totals);
                }
                totals.loops++;
                stream.incrementLoopCount();

                List<Message> messages = context.getContext(settings.autoCompress());
                context.ensureWithinBudget();

                stream.startThinking();
                LlmResponse response = llmCallExecutor.call(buildRequest(messages), signal, stream);
                recordUsage(response, totals);
                stream.completeThinking(response.getReasoningContent());

                if (signal.isCancelled()) {
                    return cancelled(totals);
                }

                if (response.hasToolCalls()) {
                    runTools(response, signal);
                    continue;
                }

                String answer = finalAnswer(response);
                context.addToCurrentTurn(Message.builder()
                        .role(Message.ROLE_ASSISTANT)
                        .content(answer)
                        .reasoningContent(response.getReasoningContent())
                        .build());
                log.debug("[Loop] Turn completed after {} loop(s)", totals.loops);
                return withTotals(AgentRunResult.builder()
                        .status(AgentRunResult.Status.COMPLETED)
                        .content(answer)
                        .loopCount(totals.loops)
                        .build(), totals);
            }
        } catch (ContextOverflowException e) {
            log.warn("[Loop] {}", e.getMessage());
            return withTotals(AgentRunResult.failed(AgentRunResult.FailureKind.CONTEXT_OVERFLOW, e.getMessage(),
                    totals.loops), totals);
        } catch (LlmCallException e) {
            return withTotals(AgentRunResult.failed(AgentRunResult.FailureKind.LLM_FAILURE, e.getMessage(),
                    totals.loops), totals);
        } catch (OperationCancelledException e) {
            log.debug("[Loop] Cancelled: {}", e.getMessage());
            return cancelled(totals);
        } catch (SessionPersistenceException e) {
            log.error("[Loop] Persistence failed mid-turn", e);
            return withTotals(AgentRunResult.failed(AgentRunResult.FailureKind.PERSISTENCE_FAILURE, e.getMessage(),
                    totals.loops), totals);
        }
    }

    /**
     * Executes the requested tools, then appends the assistant message and one
     * tool message per call so the unit lands in the turn complete.
     */
    private void runTools(LlmResponse response, CancellationSignal signal) {
        List<Message.ToolCall> toolCalls = ensureIds(response.getToolCalls());
        List<ToolCallRequest> requests = toolCalls.stream().map(ToolCallRequest::fromToolCall).toList();
        String narration = response.getContent() != null ? response.getContent().trim() : null;

        log.debug("[Loop] Model requested {} tool call(s)", requests.size());
        List<SchedulerToolCallRecord> records = scheduler.scheduleBatch(requests, narration, signal);

        context.addToCurrentTurn(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent() != null ? response.getContent() : "")
                .reasoningContent(response.getReasoningContent())
                .toolCalls(toolCalls)
                .build());
        for (SchedulerToolCallRecord callRecord : records) {
            context.addToCurrentTurn(callRecord.toToolMessage());
        }
    }

    private LlmRequest buildRequest(List<Message> messages) {
        return LlmRequest.builder()
                .model(settings.model() != null ? settings.model() : llmCallExecutor.defaultModel())
                .messages(new ArrayList<>(messages))
                .tools(registry.getDefinitions())
                .build();
    }

    private void recordUsage(LlmResponse response, TurnTotals totals) {
        LlmUsage usage = response.getUsage();
        if (usage == null) {
            return;
        }
        double cost = settings.cost(usage.getInputTokens(), usage.getOutputTokens());
        totals.inputTokens += usage.getInputTokens();
        totals.outputTokens += usage.getOutputTokens();
        totals.cost += cost;
        stream.updateStats(usage.getInputTokens(), usage.getOutputTokens(), cost);
        context.updateTokenCount(usage.getInputTokens());
        context.recordUsage(usage.getInputTokens(), usage.getOutputTokens(), cost);
    }

    private static List<Message.ToolCall> ensureIds(List<Message.ToolCall> toolCalls) {
        List<Message.ToolCall> result = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            if (toolCall.getId() == null || toolCall.getId().isBlank()) {
                result.add(Message.ToolCall.builder()
                        .id("call_" + UUID.randomUUID())
                        .name(toolCall.getName())
                        .arguments(toolCall.getArguments())
                        .build());
            } else {
                result.add(toolCall);
            }
        }
        return result;
    }

    // Reasoning-only answers happen with some thinking models
    private static String finalAnswer(LlmResponse response) {
        String content = response.getContent();
        if (content != null && !content.isBlank()) {
            return content;
        }
        return response.getReasoningContent() != null ? response.getReasoningContent() : "";
    }

    private static AgentRunResult cancelled(TurnTotals totals) {
        return withTotals(AgentRunResult.cancelled(totals.loops), totals);
    }

    private static AgentRunResult withTotals(AgentRunResult result, TurnTotals totals) {
        return new AgentRunResult(result.status(), result.content(), result.failureKind(), result.error(),
                result.loopCount(), totals.inputTokens, totals.outputTokens, totals.cost);
    }

    private static final class TurnTotals {
        private int loops;
        private long inputTokens;
        private long outputTokens;
        private double cost;
    }
}
