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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Presentation view of one tool call inside the execution snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallSummary {

    private String callId;
    private String toolName;
    private String category;
    private String paramsSummary;
    private String thinking;
    private ToolCallStatus status;
    private Instant startTime;
    private Long durationMs;
    private String resultSummary;
    private String error;

    @Builder.Default
    private List<SubToolProgress> subToolCalls = new ArrayList<>();

    /**
     * Progress reported by a nested (sub-agent) tool call.
     */
    public record SubToolProgress(String subToolCallId, String toolName, String paramsSummary, String status,
            String resultSummary, String error) {
    }
}
