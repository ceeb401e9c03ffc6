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

import java.time.Instant;
import java.util.Map;

/**
 * Event published by the execution stream. Tool events always carry
 * {@code callId} and {@code toolName} in the payload so consumers can correlate
 * without looking back.
 */
@Builder
public record ExecutionEvent(ExecutionEventType type, Instant timestamp, String sessionId,
        Map<String, Object> payload) {

    public Object get(String key) {
        return payload != null ? payload.get(key) : null;
    }

    public String getString(String key) {
        Object value = get(key);
        return value != null ? value.toString() : null;
    }
}
