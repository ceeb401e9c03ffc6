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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.LlmCallException;
import me.golemcore.agent.domain.exception.OperationCancelledException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.tool.CancellationSignal;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the LLM for the agent loop. Transient failures (rate limits, timeouts,
 * server and network errors) are retried with exponential backoff up to the
 * configured attempt count; anything else fails immediately with
 * {@link LlmCallException}. Backoff waits and the call itself observe the
 * turn's cancellation signal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmCallExecutor {

    private final LlmPort llmPort;
    private final AgentProperties properties;

    public LlmResponse call(LlmRequest request, CancellationSignal signal, ExecutionStreamManager stream) {
        AgentProperties.LoopProperties loop = properties.getLoop();
        int maxAttempts = Math.max(1, loop.getLlmMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            signal.throwIfCancelled();
            try {
                return invoke(request, signal, stream);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted while waiting for LLM");
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                String code = LlmErrorClassifier.classifyFromThrowable(cause);
                if (!LlmErrorClassifier.isTransientCode(code)) {
                    log.error("[LLM] Call failed with non-retryable error {}", code, cause);
                    throw new LlmCallException(LlmErrorClassifier.withCode(code, cause.getMessage()), attempt, cause);
                }
                if (attempt == maxAttempts) {
                    log.error("[LLM] Call failed after {} attempts: {}", attempt, cause.getMessage());
                    throw new LlmCallException(LlmErrorClassifier.withCode(code,
                            "LLM call failed after " + attempt + " attempts: " + cause.getMessage()), attempt, cause);
                }
                long backoffMs = backoffMs(attempt);
                log.warn("[LLM] {} (attempt {}/{}), retrying in {}ms", code, attempt, maxAttempts, backoffMs);
                sleep(backoffMs, signal);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    /**
     * Provider's model, used when the loop is not pinned to one.
     */
    public String defaultModel() {
        return llmPort.getCurrentModel();
    }

    long backoffMs(int attempt) {
        AgentProperties.LoopProperties loop = properties.getLoop();
        double delay = loop.getLlmInitialBackoffMs() * Math.pow(loop.getLlmBackoffMultiplier(), attempt - 1.0);
        return (long) Math.min(delay, loop.getLlmMaxBackoffMs());
    }

    private LlmResponse invoke(LlmRequest request, CancellationSignal signal, ExecutionStreamManager stream)
            throws InterruptedException, ExecutionException, TimeoutException {
        long timeoutSeconds = properties.getLoop().getLlmCallTimeoutSeconds();
        if (properties.getLoop().isStreaming() && llmPort.supportsStreaming()) {
            return consumeStream(request, signal, stream, timeoutSeconds);
        }
        return signal.await(llmPort.chat(request), timeoutSeconds, TimeUnit.SECONDS);
    }

    /**
     * Consumes a streamed response, forwarding reasoning deltas as thinking
     * events and text deltas into the snapshot.
     */
    private LlmResponse consumeStream(LlmRequest request, CancellationSignal signal, ExecutionStreamManager stream,
            long timeoutSeconds) {
        StreamAccumulator accumulator = new StreamAccumulator(stream);
        llmPort.chatStream(request)
                .takeUntilOther(Mono.fromFuture(signal.whenCancelled()))
                .doOnNext(accumulator::accept)
                .blockLast(Duration.ofSeconds(timeoutSeconds));

        signal.throwIfCancelled();
        return accumulator.toResponse();
    }

    private static void sleep(long backoffMs, CancellationSignal signal) {
        try {
            if (signal.sleep(backoffMs)) {
                throw new OperationCancelledException(signal.getReason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during LLM retry backoff");
        }
    }

    private static final class StreamAccumulator {

        private final ExecutionStreamManager stream;
        private final StringBuilder content = new StringBuilder();
        private final StringBuilder reasoning = new StringBuilder();
        private final List<Message.ToolCall> toolCalls = new ArrayList<>();
        private LlmUsage usage;
        private String finishReason;

        private StreamAccumulator(ExecutionStreamManager stream) {
            this.stream = stream;
        }

        private void accept(LlmChunk chunk) {
            if (chunk.getReasoning() != null && !chunk.getReasoning().isEmpty()) {
                reasoning.append(chunk.getReasoning());
                stream.appendThinking(chunk.getReasoning());
            }
            if (chunk.getText() != null && !chunk.getText().isEmpty()) {
                content.append(chunk.getText());
                stream.appendStreamingContent(chunk.getText());
            }
            if (chunk.getToolCalls() != null) {
                toolCalls.addAll(chunk.getToolCalls());
            }
            if (chunk.getUsage() != null) {
                usage = chunk.getUsage();
            }
            if (chunk.getFinishReason() != null) {
                finishReason = chunk.getFinishReason();
            }
        }

        private LlmResponse toResponse() {
            return LlmResponse.builder()
                    .content(content.toString())
                    .reasoningContent(reasoning.length() > 0 ? reasoning.toString() : null)
                    .toolCalls(toolCalls.isEmpty() ? null : new ArrayList<>(toolCalls))
                    .usage(usage)
                    .finishReason(finishReason != null ? finishReason : "stop")
                    .build();
        }
    }
}
