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

package me.golemcore.agent.domain.model;

/**
 * Event taxonomy of the execution stream. {@link #getId()} is the stable wire
 * name consumed by presentation layers.
 */
public enum ExecutionEventType {

    EXECUTION_START("execution:start"),
    EXECUTION_COMPLETE("execution:complete"),
    EXECUTION_ERROR("execution:error"),
    EXECUTION_CANCEL("execution:cancel"),

    TOOL_VALIDATING("tool:validating"),
    TOOL_AWAITING_APPROVAL("tool:awaiting_approval"),
    TOOL_EXECUTING("tool:executing"),
    TOOL_COMPLETE("tool:complete"),
    TOOL_ERROR("tool:error"),
    TOOL_CANCELLED("tool:cancelled"),
    TOOL_PROGRESS("tool:progress"),

    THINKING_START("thinking:start"),
    THINKING_DELTA("thinking:delta"),
    THINKING_COMPLETE("thinking:complete"),

    COMPRESSION_START("compression:start"),
    COMPRESSION_COMPLETE("compression:complete");

    private final String id;

    ExecutionEventType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean isToolEvent() {
        return id.startsWith("tool:");
    }
}
