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
import me.golemcore.agent.domain.model.ApprovalMode;

/**
 * Tunables of one {@link ToolScheduler}.
 */
@Builder
public record SchedulerSettings(ApprovalMode approvalMode, long serialDelayMs, long toolTimeoutSeconds,
        boolean summarizeOutput, int summaryThresholdTokens) {

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(ApprovalMode.DEFAULT, 500, 300, true, 2000);
    }
}
