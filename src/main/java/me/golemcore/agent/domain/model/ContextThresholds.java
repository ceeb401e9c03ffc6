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

/**
 * Context budget thresholds. Ratios are fractions of the model token limit;
 * {@code toolOutputSummary} is an absolute token count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextThresholds {

    @Builder.Default
    private double compressionTrigger = 0.70;

    @Builder.Default
    private double compressionPreserve = 0.30;

    @Builder.Default
    private double overflowWarning = 0.95;

    @Builder.Default
    private int toolOutputSummary = 2000;

    public static ContextThresholds defaults() {
        return ContextThresholds.builder().build();
    }
}
