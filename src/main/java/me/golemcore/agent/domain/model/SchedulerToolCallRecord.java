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

import lombok.Data;

import java.time.Instant;

/**
 * Mutable state of one tool call for the lifetime of a turn. Each record is
 * only written by the thread executing its call.
 */
@Data
public class SchedulerToolCallRecord {

    private final ToolCallRequest request;
    private volatile ToolCallStatus status = ToolCallStatus.VALIDATING;
    private final Instant startTime;
    private Instant endTime;
    private ConfirmDetails confirmDetails;

    /**
     * Raw result as returned by the tool, kept for audit.
     */
    private ToolResult result;

    /**
     * Content handed back to the model, possibly summarized.
     */
    private String modelContent;
    private String error;
    private Long durationMs;

    public SchedulerToolCallRecord(ToolCallRequest request, Instant startTime) {
        this.request = request;
        this.startTime = startTime;
    }

    public String getCallId() {
        return request.getCallId();
    }

    public String getToolName() {
        return request.getToolName();
    }

    /**
     * Builds the tool message answering this call.
     */
    public Message toToolMessage() {
        String content = switch (status) {
        case SUCCESS -> modelContent != null ? modelContent : "";
        case CANCELLED -> "Tool call cancelled: " + (error != null ? error : "cancelled");
        case ERROR -> modelContent != null ? modelContent : "Error: " + error;
        default -> "Tool call did not complete (status " + status + ")";
        };
        return Message.tool(getCallId(), getToolName(), content);
    }
}
