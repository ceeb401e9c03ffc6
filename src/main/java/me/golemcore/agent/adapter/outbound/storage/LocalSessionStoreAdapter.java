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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.SessionPersistenceException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.SessionStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local filesystem implementation of {@link SessionStorePort}.
 *
 * <p>
 * Each session lives in {@code <basePath>/<sessionsDirectory>/<sessionId>/session.json}
 * holding both the message log and the checkpoint, so every write replaces the
 * pair atomically. Files are written to a temp sibling, fsynced and renamed
 * into place.
 *
 * <p>
 * Base path configured via {@code agent.storage.base-path}, defaults to
 * {@code ${user.home}/.golemcore/agent}.
 */
@Component
@ConditionalOnProperty(prefix = "agent.storage", name = "type", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalSessionStoreAdapter implements SessionStorePort {

    static final String SESSION_FILE = "session.json";

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    private Path sessionsPath;

    public LocalSessionStoreAdapter(AgentProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        AgentProperties.StorageProperties storage = properties.getStorage();
        Path basePath = Paths.get(storage.getBasePath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.sessionsPath = basePath.resolve(storage.getSessionsDirectory()).normalize();
        try {
            Files.createDirectories(sessionsPath);
            log.info("[Storage] Session store initialized at: {}", sessionsPath);
        } catch (IOException e) {
            throw new SessionPersistenceException("Failed to create sessions directory: " + sessionsPath, e);
        }
    }

    @Override
    public void saveMessages(String sessionId, List<Message> messages) {
        synchronized (lockFor(sessionId)) {
            SessionData data = read(sessionId).orElseGet(() -> empty(sessionId));
            data.setMessages(new ArrayList<>(messages));
            write(data);
        }
    }

    @Override
    public List<Message> loadMessages(String sessionId) {
        return read(sessionId).map(SessionData::getMessages).orElseGet(ArrayList::new);
    }

    @Override
    public void saveCheckpoint(String sessionId, SessionCheckpoint checkpoint) {
        synchronized (lockFor(sessionId)) {
            SessionData data = read(sessionId).orElseGet(() -> empty(sessionId));
            data.setCheckpoint(checkpoint);
            write(data);
        }
    }

    @Override
    public Optional<SessionCheckpoint> loadCheckpoint(String sessionId) {
        return read(sessionId).map(SessionData::getCheckpoint);
    }

    @Override
    public void deleteCheckpoint(String sessionId) {
        synchronized (lockFor(sessionId)) {
            Optional<SessionData> data = read(sessionId);
            if (data.isPresent() && data.get().getCheckpoint() != null) {
                data.get().setCheckpoint(null);
                write(data.get());
                log.debug("[Storage] Deleted checkpoint of session {}", sessionId);
            }
        }
    }

    @Override
    public void saveSessionData(SessionData data) {
        synchronized (lockFor(data.getSessionId())) {
            write(data);
        }
    }

    @Override
    public Optional<SessionData> loadSessionData(String sessionId) {
        return read(sessionId);
    }

    Path sessionFile(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        Path sessionDir = sessionsPath.resolve(sessionId).normalize();
        if (!sessionDir.startsWith(sessionsPath) || sessionDir.equals(sessionsPath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        return sessionDir.resolve(SESSION_FILE);
    }

    private Optional<SessionData> read(String sessionId) {
        Path file = sessionFile(sessionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            SessionData data = objectMapper.readValue(file.toFile(), SessionData.class);
            if (data.getMessages() == null) {
                data.setMessages(new ArrayList<>());
            }
            return Optional.of(data);
        } catch (IOException e) {
            throw new SessionPersistenceException("Failed to read session " + sessionId, e);
        }
    }

    private void write(SessionData data) {
        data.setUpdatedAt(clock.instant());
        Path target = sessionFile(data.getSessionId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(data);
            try (OutputStream os = Files.newOutputStream(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Storage] Saved session {} ({} messages)", data.getSessionId(), data.getMessages().size());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", temp);
            }
            throw new SessionPersistenceException("Failed to write session " + data.getSessionId(), e);
        }
    }

    private Object lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, id -> new Object());
    }

    private static SessionData empty(String sessionId) {
        return SessionData.builder().sessionId(sessionId).build();
    }
}
