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

package me.golemcore.agent.port.outbound;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence contract for sessions. Writes are durable once the
 * method returns; reads return the most recent successful write. Failures are
 * reported as {@link me.golemcore.agent.domain.exception.SessionPersistenceException}.
 */
public interface SessionStorePort {

    void saveMessages(String sessionId, List<Message> messages);

    List<Message> loadMessages(String sessionId);

    void saveCheckpoint(String sessionId, SessionCheckpoint checkpoint);

    Optional<SessionCheckpoint> loadCheckpoint(String sessionId);

    void deleteCheckpoint(String sessionId);

    /**
     * Atomically replaces both messages and checkpoint.
     */
    void saveSessionData(SessionData data);

    Optional<SessionData> loadSessionData(String sessionId);
}
