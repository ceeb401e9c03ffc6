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

package me.golemcore.agent.domain.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.domain.model.Message;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic token estimator. Not a tokenizer match, but monotonic and
 * deterministic so threshold comparisons are stable across calls.
 *
 * <p>
 * CJK ideographs cost one token per 1.5 characters, everything else one token
 * per 4 characters; both counts are rounded up and summed. Non-string values
 * are serialized to JSON first.
 */
public final class TokenEstimator {

    private static final double CJK_CHARS_PER_TOKEN = 1.5;
    private static final double CHARS_PER_TOKEN = 4.0;
    private static final int MESSAGE_OVERHEAD_TOKENS = 4;
    private static final char CJK_START = '\u4e00';
    private static final char CJK_END = '\u9fff';

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private TokenEstimator() {
    }

    public static int estimate(Object content) {
        if (content == null) {
            return 0;
        }
        String text = content instanceof String s ? s : serialize(content);
        if (text.isEmpty()) {
            return 0;
        }

        int cjk = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= CJK_START && c <= CJK_END) {
                cjk++;
            }
        }
        int other = text.length() - cjk;
        return (int) Math.ceil(cjk / CJK_CHARS_PER_TOKEN) + (int) Math.ceil(other / CHARS_PER_TOKEN);
    }

    public static int estimateMessage(Message message) {
        if (message == null) {
            return 0;
        }
        int tokens = estimate(message.getContent()) + MESSAGE_OVERHEAD_TOKENS;
        if (message.hasToolCalls()) {
            tokens += estimate(message.getToolCalls());
        }
        if (message.getToolCallId() != null) {
            tokens += estimate(message.getToolCallId());
        }
        if (message.getName() != null) {
            tokens += estimate(message.getName());
        }
        return tokens;
    }

    public static int estimateMessages(List<Message> messages) {
        if (messages == null) {
            return 0;
        }
        int total = 0;
        for (Message message : messages) {
            total += estimateMessage(message);
        }
        return total;
    }

    /**
     * Formats a token count for display: {@code 950}, {@code 1.2K},
     * {@code 1.23M}.
     */
    public static String formatTokens(long tokens) {
        if (tokens < 1000) {
            return String.valueOf(tokens);
        }
        if (tokens < 1_000_000) {
            return String.format(Locale.ROOT, "%.1fK", tokens / 1000.0);
        }
        return String.format(Locale.ROOT, "%.2fM", tokens / 1_000_000.0);
    }

    private static String serialize(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Still estimate something deterministic for unserializable values
            return String.valueOf(value);
        }
    }
}
