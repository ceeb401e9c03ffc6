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

import lombok.Builder;

/**
 * Tunables of one {@link AgentLoop}.
 */
@Builder
public record LoopSettings(String model, int maxLoops, boolean autoCompress, double inputCostPer1k,
        double outputCostPer1k) {

    public static LoopSettings defaults() {
        return new LoopSettings(null, 100, true, 0.0, 0.0);
    }

    public double cost(long inputTokens, long outputTokens) {
        return inputTokens / 1000.0 * inputCostPer1k + outputTokens / 1000.0 * outputCostPer1k;
    }
}
