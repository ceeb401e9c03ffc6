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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.context.ContextChecker;
import me.golemcore.agent.domain.context.ContextManager;
import me.golemcore.agent.domain.context.HistoryCompressor;
import me.golemcore.agent.domain.context.ToolOutputSummarizer;
import me.golemcore.agent.domain.execution.ExecutionStreamManager;
import me.golemcore.agent.domain.execution.MarkdownExecutionLog;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.ContextThresholds;
import me.golemcore.agent.domain.tool.Allowlist;
import me.golemcore.agent.domain.tool.ArgumentParser;
import me.golemcore.agent.domain.tool.SchedulerSettings;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.domain.tool.ToolScheduler;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import me.golemcore.agent.port.outbound.SessionStorePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds fully wired {@link AgentSession}s from the shared services. Each
 * session gets its own context, event stream, allowlist and scheduler; the
 * pool for parallel read-only tool batches is shared.
 */
@Service
@Slf4j
public class AgentSessionFactory {

    private final LlmCallExecutor llmCallExecutor;
    private final HistoryCompressor historyCompressor;
    private final ToolOutputSummarizer outputSummarizer;
    private final ToolRegistry toolRegistry;
    private final SessionStorePort sessionStore;
    private final ObjectProvider<ConfirmationPort> confirmationPortProvider;
    private final AgentProperties properties;
    private final Clock clock;
    private final ArgumentParser argumentParser;
    private final ExecutorService toolExecutor;

    public AgentSessionFactory(LlmCallExecutor llmCallExecutor, HistoryCompressor historyCompressor,
            ToolOutputSummarizer outputSummarizer, ToolRegistry toolRegistry, SessionStorePort sessionStore,
            ObjectProvider<ConfirmationPort> confirmationPortProvider, AgentProperties properties, Clock clock,
            ObjectMapper objectMapper) {
        this.llmCallExecutor = llmCallExecutor;
        this.historyCompressor = historyCompressor;
        this.outputSummarizer = outputSummarizer;
        this.toolRegistry = toolRegistry;
        this.sessionStore = sessionStore;
        this.confirmationPortProvider = confirmationPortProvider;
        this.properties = properties;
        this.clock = clock;
        this.argumentParser = new ArgumentParser(objectMapper);
        this.toolExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getScheduler().getParallelPoolSize()), new ToolThreadFactory());
    }

    /**
     * Creates a session using the confirmation handler from the context, if
     * one is registered. The session is not yet initialized.
     */
    public AgentSession create(String sessionId) {
        return create(sessionId, confirmationPortProvider.getIfAvailable());
    }

    public AgentSession create(String sessionId, ConfirmationPort confirmationPort) {
        AgentProperties.ContextProperties contextProps = properties.getContext();
        AgentProperties.SchedulerProperties schedulerProps = properties.getScheduler();

        ContextThresholds thresholds = ContextThresholds.builder()
                .compressionTrigger(contextProps.getCompressionTrigger())
                .compressionPreserve(contextProps.getCompressionPreserve())
                .overflowWarning(contextProps.getOverflowWarning())
                .toolOutputSummary(contextProps.getToolOutputSummaryTokens())
                .build();

        ExecutionStreamManager stream = new ExecutionStreamManager(sessionId, clock);
        if (properties.getStorage().isExecutionLogEnabled()) {
            stream.on(MarkdownExecutionLog.open(executionLogDir(), sessionId));
        }
        ContextManager context = new ContextManager(sessionId, contextProps.getSystemPrompt(),
                new ContextChecker(contextProps.getModelTokenLimit(), thresholds), historyCompressor, sessionStore,
                stream, clock);

        SchedulerSettings schedulerSettings = SchedulerSettings.builder()
                .approvalMode(ApprovalMode.parse(schedulerProps.getApprovalMode()))
                .serialDelayMs(schedulerProps.getSerialDelayMs())
                .toolTimeoutSeconds(schedulerProps.getToolTimeoutSeconds())
                .summarizeOutput(schedulerProps.isSummarizeOutput())
                .summaryThresholdTokens(contextProps.getToolOutputSummaryTokens())
                .build();
        ToolScheduler scheduler = new ToolScheduler(sessionId, toolRegistry, new Allowlist(), confirmationPort,
                stream, outputSummarizer, argumentParser, toolExecutor, schedulerSettings, clock);

        LoopSettings loopSettings = LoopSettings.builder()
                .maxLoops(properties.getLoop().getMaxLoops())
                .autoCompress(contextProps.isAutoCompress())
                .inputCostPer1k(properties.getPricing().getInputCostPer1k())
                .outputCostPer1k(properties.getPricing().getOutputCostPer1k())
                .build();
        AgentLoop loop = new AgentLoop(context, llmCallExecutor, scheduler, toolRegistry, stream, loopSettings);

        log.debug("[Session] Created session {} (approval mode {})", sessionId, schedulerSettings.approvalMode());
        return new AgentSession(sessionId, context, scheduler, stream, loop, sessionStore);
    }

    /**
     * Creates a session and restores its stored state.
     */
    public AgentSession open(String sessionId) {
        AgentSession session = create(sessionId);
        session.init();
        return session;
    }

    private Path executionLogDir() {
        AgentProperties.StorageProperties storage = properties.getStorage();
        return Paths.get(storage.getBasePath().replace("${user.home}", System.getProperty("user.home")))
                .resolve(storage.getExecutionLogDirectory());
    }

    @PreDestroy
    public void shutdown() {
        toolExecutor.shutdownNow();
        try {
            if (!toolExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Session] Tool executor did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ToolThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agent-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
