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

/**
 * Persisted compression artifact. On resume the context is rebuilt as
 * {@code summary} followed by every stored message after
 * {@code loadAfterMessageId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCheckpoint {

    private String summary;
    private String loadAfterMessageId;
    private Instant compressedAt;

    @Builder.Default
    private Stats stats = new Stats();

    /**
     * Cumulative totals carried across compressions and resumes.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private double totalCost;
        private long totalInputTokens;
        private long totalOutputTokens;
    }
}
