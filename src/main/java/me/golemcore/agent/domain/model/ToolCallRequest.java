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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * A single tool invocation handed to the scheduler. Either {@code rawArguments}
 * (model-produced JSON) or already-parsed {@code arguments} may be set.
 */
@Data
@Builder(toBuilder = true)
public class ToolCallRequest {

    private String callId;
    private String toolName;
    private String rawArguments;
    private Map<String, Object> arguments;
    private String category;
    private String paramsSummary;
    private String thinkingContent;

    public static ToolCallRequest fromToolCall(Message.ToolCall toolCall) {
        return ToolCallRequest.builder()
                .callId(toolCall.getId())
                .toolName(toolCall.getName())
                .rawArguments(toolCall.getArguments())
                .build();
    }
}
