package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.exception.LlmCallException;
import me.golemcore.agent.domain.exception.OperationCancelledException;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.model.ExecutionSnapshot;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.tool.CancellationSignal;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmCallExecutorTest {

    private static final LlmRequest REQUEST = LlmRequest.builder()
            .messages(List.of(Message.user("hi")))
            .build();

    private LlmPort llmPort;
    private AgentProperties properties;
    private ExecutionStreamManager stream;
    private LlmCallExecutor executor;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new AgentProperties();
        properties.getLoop().setLlmInitialBackoffMs(0);
        properties.getLoop().setLlmMaxAttempts(3);
        stream = new ExecutionStreamManager("s1", Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC));
        executor = new LlmCallExecutor(llmPort, properties);
    }

    private static CompletableFuture<LlmResponse> answer(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    private static CompletableFuture<LlmResponse> failure(String message) {
        return CompletableFuture.failedFuture(new RuntimeException(message));
    }

    @Test
    void shouldReturnResponse() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(answer("hello"));

        LlmResponse response = executor.call(REQUEST, new CancellationSignal(), stream);

        assertEquals("hello", response.getContent());
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldRetryTransientFailure() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(failure("429 Too Many Requests"), answer("after retry"));

        LlmResponse response = executor.call(REQUEST, new CancellationSignal(), stream);

        assertEquals("after retry", response.getContent());
        verify(llmPort, times(2)).chat(any());
    }

    @Test
    void shouldFailImmediatelyOnNonTransientError() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(failure("401 Unauthorized"));

        LlmCallException ex = assertThrows(LlmCallException.class,
                () -> executor.call(REQUEST, new CancellationSignal(), stream));

        assertEquals(1, ex.getAttempts());
        assertTrue(ex.getMessage().startsWith("[" + LlmErrorClassifier.AUTHENTICATION + "]"));
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(failure("503 Service Unavailable"));

        LlmCallException ex = assertThrows(LlmCallException.class,
                () -> executor.call(REQUEST, new CancellationSignal(), stream));

        assertEquals(3, ex.getAttempts());
        assertTrue(ex.getMessage().contains("after 3 attempts"));
        verify(llmPort, times(3)).chat(any());
    }

    @Test
    void shouldRetrySynchronousTransientThrow() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenThrow(new RuntimeException("connection reset by peer"))
                .thenReturn(answer("ok"));

        assertEquals("ok", executor.call(REQUEST, new CancellationSignal(), stream).getContent());
    }

    @Test
    void shouldNotCallWhenAlreadyCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("user abort");

        assertThrows(OperationCancelledException.class, () -> executor.call(REQUEST, signal, stream));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldAbortPendingCallOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(inv -> {
            signal.cancel("user abort");
            return pending;
        });

        assertThrows(OperationCancelledException.class, () -> executor.call(REQUEST, signal, stream));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldComputeCappedExponentialBackoff() {
        properties.getLoop().setLlmInitialBackoffMs(1000);
        properties.getLoop().setLlmBackoffMultiplier(2.0);
        properties.getLoop().setLlmMaxBackoffMs(5000);

        assertEquals(1000, executor.backoffMs(1));
        assertEquals(2000, executor.backoffMs(2));
        assertEquals(4000, executor.backoffMs(3));
        assertEquals(5000, executor.backoffMs(4));
    }

    @Test
    void shouldAccumulateStreamedResponse() {
        properties.getLoop().setStreaming(true);
        when(llmPort.supportsStreaming()).thenReturn(true);
        Message.ToolCall call = Message.ToolCall.builder().id("c1").name("Grep").arguments("{}").build();
        when(llmPort.chatStream(any(LlmRequest.class))).thenReturn(Flux.just(
                LlmChunk.builder().reasoning("Looking ").build(),
                LlmChunk.builder().reasoning("around").text("Hel").build(),
                LlmChunk.builder().text("lo").toolCalls(List.of(call)).usage(LlmUsage.of(10, 5))
                        .finishReason("tool_calls").done(true).build()));
        stream.start();

        LlmResponse response = executor.call(REQUEST, new CancellationSignal(), stream);

        assertEquals("Hello", response.getContent());
        assertEquals("Looking around", response.getReasoningContent());
        assertEquals(List.of(call), response.getToolCalls());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals("tool_calls", response.getFinishReason());
        ExecutionSnapshot snapshot = stream.getSnapshot();
        assertEquals("Looking around", snapshot.thinking());
        assertEquals("Hello", snapshot.streamingContent());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldUseChatWhenProviderCannotStream() {
        properties.getLoop().setStreaming(true);
        when(llmPort.supportsStreaming()).thenReturn(false);
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(answer("plain"));

        assertEquals("plain", executor.call(REQUEST, new CancellationSignal(), stream).getContent());
    }
}
