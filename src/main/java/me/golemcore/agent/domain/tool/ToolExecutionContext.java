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

package me.golemcore.agent.domain.tool;

import lombok.Builder;
import lombok.Getter;
import me.golemcore.agent.domain.model.ToolCallSummary;

/**
 * Per-call context handed to a tool: identifies the call so nested tools can
 * attribute their own events, and carries the turn's cancellation signal.
 */
@Getter
@Builder
public class ToolExecutionContext {

    private final String callId;
    private final String toolName;
    private final String sessionId;

    @Builder.Default
    private final CancellationSignal signal = new CancellationSignal();

    private final ToolProgressReporter progressReporter;

    public void reportProgress(ToolCallSummary.SubToolProgress progress) {
        if (progressReporter != null) {
            progressReporter.report(progress);
        }
    }

    public boolean isCancelled() {
        return signal.isCancelled();
    }

    public static ToolExecutionContext of(String callId, String toolName) {
        return ToolExecutionContext.builder().callId(callId).toolName(toolName).build();
    }
}
