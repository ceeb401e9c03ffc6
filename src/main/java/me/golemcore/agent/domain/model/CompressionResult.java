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

import java.util.List;

/**
 * Outcome of a history compression attempt. When {@code compressed} is false
 * {@code messages} is the untouched input history.
 */
@Builder
public record CompressionResult(boolean compressed, List<Message> messages, int originalCount, int compressedCount,
        int originalTokens, int compressedTokens, String summary, String lastCompressedMessageId) {

    public static CompressionResult notCompressed(List<Message> history, int tokens) {
        int count = history != null ? history.size() : 0;
        return new CompressionResult(false, history, count, count, tokens, tokens, null, null);
    }

    public int savedTokens() {
        return Math.max(0, originalTokens - compressedTokens);
    }

    public int savedPercentage() {
        if (originalTokens <= 0) {
            return 0;
        }
        return (int) Math.round(savedTokens() * 100.0 / originalTokens);
    }
}
