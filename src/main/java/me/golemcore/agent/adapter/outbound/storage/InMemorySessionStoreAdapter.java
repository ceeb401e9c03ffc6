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

package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import me.golemcore.agent.port.outbound.SessionStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile session store for tests and embedding. Returned values are copies,
 * so callers cannot mutate stored state.
 */
@Component
@ConditionalOnProperty(prefix = "agent.storage", name = "type", havingValue = "memory")
public class InMemorySessionStoreAdapter implements SessionStorePort {

    private final Map<String, SessionData> sessions = new ConcurrentHashMap<>();

    @Override
    public void saveMessages(String sessionId, List<Message> messages) {
        sessions.compute(sessionId, (id, existing) -> {
            SessionData data = existing != null ? existing : SessionData.builder().sessionId(id).build();
            data.setMessages(new ArrayList<>(messages));
            return data;
        });
    }

    @Override
    public List<Message> loadMessages(String sessionId) {
        SessionData data = sessions.get(sessionId);
        return data != null ? new ArrayList<>(data.getMessages()) : new ArrayList<>();
    }

    @Override
    public void saveCheckpoint(String sessionId, SessionCheckpoint checkpoint) {
        sessions.compute(sessionId, (id, existing) -> {
            SessionData data = existing != null ? existing : SessionData.builder().sessionId(id).build();
            data.setCheckpoint(checkpoint);
            return data;
        });
    }

    @Override
    public Optional<SessionCheckpoint> loadCheckpoint(String sessionId) {
        SessionData data = sessions.get(sessionId);
        return data != null ? Optional.ofNullable(data.getCheckpoint()) : Optional.empty();
    }

    @Override
    public void deleteCheckpoint(String sessionId) {
        sessions.computeIfPresent(sessionId, (id, data) -> {
            data.setCheckpoint(null);
            return data;
        });
    }

    @Override
    public void saveSessionData(SessionData data) {
        sessions.put(data.getSessionId(), copy(data));
    }

    @Override
    public Optional<SessionData> loadSessionData(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(InMemorySessionStoreAdapter::copy);
    }

    private static SessionData copy(SessionData data) {
        return SessionData.builder()
                .sessionId(data.getSessionId())
                .messages(new ArrayList<>(data.getMessages() != null ? data.getMessages() : List.of()))
                .checkpoint(data.getCheckpoint())
                .updatedAt(data.getUpdatedAt())
                .build();
    }
}
