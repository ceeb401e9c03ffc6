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

package me.golemcore.agent.infrastructure.config;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the agent core, bound from
 * application.properties under the {@code agent.*} prefix.
 *
 * <ul>
 * <li>{@link ContextProperties} - token budget and compression</li>
 * <li>{@link SchedulerProperties} - approval mode and tool execution</li>
 * <li>{@link LoopProperties} - agent loop bounds and LLM retries</li>
 * <li>{@link PricingProperties} - cost accounting</li>
 * <li>{@link StorageProperties} - session persistence</li>
 * <li>{@link ToolsProperties} - built-in tools</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private ContextProperties context = new ContextProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private LoopProperties loop = new LoopProperties();
    private PricingProperties pricing = new PricingProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private int modelTokenLimit = 128_000;
        private double compressionTrigger = 0.70;
        private double compressionPreserve = 0.30;
        private double overflowWarning = 0.95;
        private int toolOutputSummaryTokens = 2000;
        private long summaryTimeoutMs = 60_000;
        private boolean autoCompress = true;
        private String systemPrompt = "You are a helpful coding agent. Use the available tools to inspect and change the workspace.";
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        /**
         * default, autoEdit or yolo (alias fullAuto).
         */
        private String approvalMode = "default";
        private long serialDelayMs = 500;
        private long toolTimeoutSeconds = 300;
        private boolean summarizeOutput = true;
        private int parallelPoolSize = 8;
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxLoops = 100;
        private int llmMaxAttempts = 5;
        private long llmInitialBackoffMs = 5000;
        private double llmBackoffMultiplier = 2.0;
        private long llmMaxBackoffMs = 60_000;
        private long llmCallTimeoutSeconds = 300;
        private boolean streaming = false;
    }

    // ==================== PRICING ====================

    @Data
    public static class PricingProperties {
        private double inputCostPer1k = 0.0;
        private double outputCostPer1k = 0.0;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        /**
         * local or memory.
         */
        private String type = "local";
        private String basePath = "${user.home}/.golemcore/agent";
        private String sessionsDirectory = "sessions";
        /**
         * Write a markdown trace of each session's execution events.
         */
        private boolean executionLogEnabled = false;
        private String executionLogDirectory = "logs";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private String workspace = ".";
        private boolean shellEnabled = true;
        private int shellTimeoutSeconds = 30;
        private int maxOutputChars = 100_000;
        private String searchExecutable = "rg";
        private int searchMaxCount = 100;
    }
}
