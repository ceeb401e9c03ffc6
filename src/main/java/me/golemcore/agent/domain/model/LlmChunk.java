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

import java.util.List;

/**
 * One element of a streamed completion. Text and reasoning arrive as deltas;
 * the final chunk has {@code done} set and may carry tool calls and usage.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private String reasoning;
    private List<Message.ToolCall> toolCalls;
    private boolean done;
    private LlmUsage usage;
    private String finishReason;
}
