package me.golemcore.agent.domain.context;

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.ToolOutputProcessResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolOutputSummarizerTest {

    private static final String TOOL_NAME = "Grep";

    private LlmPort llmPort;
    private ToolOutputSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        summarizer = new ToolOutputSummarizer(llmPort, new AgentProperties());
    }

    private static String lines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
    }

    @Test
    void shouldPassSmallOutputThrough() {
        ToolOutputProcessResult result = summarizer.process("small output", TOOL_NAME, 2000);

        assertFalse(result.summarized());
        assertEquals("small output", result.output());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldSummarizeOutputAboveThreshold() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content("3 matches in Foo.java").build()));
        String output = "x".repeat(400);

        ToolOutputProcessResult result = summarizer.process(output, TOOL_NAME, 50);

        assertTrue(result.summarized());
        assertFalse(result.truncated());
        assertEquals("[Tool output summary - Grep]\n3 matches in Foo.java", result.output());
        assertEquals(100, result.originalTokens());
    }

    @Test
    void shouldCapOversizedSummary() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content("y".repeat(20_000)).build()));

        String summary = summarizer.summarize("x".repeat(40_000), TOOL_NAME);

        assertTrue(summary.startsWith("[Tool output summary - Grep]\nyyy"));
        assertTrue(summary.contains("... [truncated] ..."));
        assertTrue(TokenEstimator.estimate(summary) <= ToolOutputSummarizer.MAX_SUMMARY_TOKENS + 20);
    }

    @Test
    void shouldFallBackToTruncationWhenLlmFails() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("rate limit")));
        String output = lines(1500);

        String summary = summarizer.summarize(output, TOOL_NAME);

        assertTrue(summary.contains("... [truncated, 500 lines omitted] ..."));
        assertTrue(summary.startsWith("line 1\n"));
        assertTrue(summary.endsWith("line 1500"));
    }

    @Test
    void shouldTruncateWithoutLlmWhenUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        String summary = summarizer.summarize(lines(1200), TOOL_NAME);

        assertTrue(summary.contains("200 lines omitted"));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldTruncateOversizedOutputBeforeSummarizing() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content("huge log").build()));
        String output = "y".repeat(ToolOutputSummarizer.MAX_OUTPUT_CHARS + 1);

        ToolOutputProcessResult result = summarizer.process(output, TOOL_NAME, 2000);

        assertTrue(result.truncated());
        assertTrue(result.summarized());
        assertTrue(result.processedTokens() < result.originalTokens());
    }

    @Test
    void shouldKeepShortOutputInTruncate() {
        assertEquals("a\nb", ToolOutputSummarizer.truncate("a\nb", 10));
    }

    @Test
    void shouldCutLongSingleLineByCharacters() {
        String output = "z".repeat(ToolOutputSummarizer.MAX_OUTPUT_CHARS + 500);

        String truncated = ToolOutputSummarizer.truncate(output, 1000);

        assertTrue(truncated.length() < output.length());
        assertTrue(truncated.contains("characters omitted"));
    }

    @Test
    void shouldQuickTruncateToTokenBudget() {
        String output = "q".repeat(4000);

        String truncated = ToolOutputSummarizer.quickTruncate(output, 100);

        assertTrue(truncated.contains("[truncated]"));
        assertTrue(TokenEstimator.estimate(truncated) < TokenEstimator.estimate(output));
        assertSame(output, ToolOutputSummarizer.quickTruncate(output, 5000));
    }

    @Test
    void shouldHandleNullOutput() {
        ToolOutputProcessResult result = summarizer.process(null, TOOL_NAME, 10);

        assertNull(result.output());
        assertFalse(result.summarized());
    }
}
