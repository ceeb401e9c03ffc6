package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.domain.exception.SessionPersistenceException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalSessionStoreAdapterTest {

    private static final String SESSION_ID = "session-1";
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private LocalSessionStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalSessionStoreAdapter(properties, AutoConfiguration.objectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        adapter.init();
    }

    private static List<Message> conversation() {
        Message.ToolCall call = Message.ToolCall.builder().id("c1").name("ReadFile")
                .arguments("{\"filePath\":\"a.txt\"}").build();
        return List.of(
                Message.builder().id("m1").role(Message.ROLE_USER).content("read a.txt").timestamp(NOW).build(),
                Message.builder().id("m2").role(Message.ROLE_ASSISTANT).content("").toolCalls(List.of(call))
                        .timestamp(NOW).build(),
                Message.builder().id("m3").role(Message.ROLE_TOOL).toolCallId("c1").name("ReadFile")
                        .content("hello").timestamp(NOW).build());
    }

    @Test
    void shouldCreateSessionsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
    }

    @Test
    void shouldRoundTripMessages() {
        adapter.saveMessages(SESSION_ID, conversation());

        List<Message> loaded = adapter.loadMessages(SESSION_ID);

        assertEquals(3, loaded.size());
        assertEquals("m1", loaded.get(0).getId());
        assertEquals(NOW, loaded.get(0).getTimestamp());
        assertEquals("c1", loaded.get(1).getToolCalls().get(0).getId());
        assertEquals("{\"filePath\":\"a.txt\"}", loaded.get(1).getToolCalls().get(0).getArguments());
        assertEquals("c1", loaded.get(2).getToolCallId());
        assertTrue(Files.exists(tempDir.resolve("sessions").resolve(SESSION_ID)
                .resolve(LocalSessionStoreAdapter.SESSION_FILE)));
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(adapter.loadMessages("unknown").isEmpty());
        assertTrue(adapter.loadCheckpoint("unknown").isEmpty());
        assertTrue(adapter.loadSessionData("unknown").isEmpty());
    }

    @Test
    void shouldKeepMessagesWhenSavingCheckpoint() {
        adapter.saveMessages(SESSION_ID, conversation());
        adapter.saveCheckpoint(SESSION_ID, SessionCheckpoint.builder()
                .summary("Read a file.")
                .loadAfterMessageId("m2")
                .compressedAt(NOW)
                .stats(SessionCheckpoint.Stats.builder().totalCost(0.25).totalInputTokens(120).build())
                .build());

        SessionData data = adapter.loadSessionData(SESSION_ID).orElseThrow();

        assertEquals(3, data.getMessages().size());
        assertEquals("Read a file.", data.getCheckpoint().getSummary());
        assertEquals("m2", data.getCheckpoint().getLoadAfterMessageId());
        assertEquals(0.25, data.getCheckpoint().getStats().getTotalCost(), 0.0001);
        assertEquals(NOW, data.getUpdatedAt());
    }

    @Test
    void shouldDeleteCheckpointOnly() {
        adapter.saveMessages(SESSION_ID, conversation());
        adapter.saveCheckpoint(SESSION_ID, SessionCheckpoint.builder().summary("s").loadAfterMessageId("m1").build());

        adapter.deleteCheckpoint(SESSION_ID);

        assertTrue(adapter.loadCheckpoint(SESSION_ID).isEmpty());
        assertEquals(3, adapter.loadMessages(SESSION_ID).size());
    }

    @Test
    void shouldIgnoreDeleteOfMissingCheckpoint() {
        assertDoesNotThrow(() -> adapter.deleteCheckpoint(SESSION_ID));
        assertTrue(adapter.loadSessionData(SESSION_ID).isEmpty());
    }

    @Test
    void shouldReplaceSessionData() {
        adapter.saveMessages(SESSION_ID, conversation());

        adapter.saveSessionData(SessionData.builder()
                .sessionId(SESSION_ID)
                .messages(List.of(Message.user("fresh")))
                .build());

        Optional<SessionData> data = adapter.loadSessionData(SESSION_ID);
        assertTrue(data.isPresent());
        assertEquals(1, data.get().getMessages().size());
        assertNull(data.get().getCheckpoint());
    }

    @Test
    void shouldLeaveNoTempFileBehind() throws Exception {
        adapter.saveMessages(SESSION_ID, conversation());

        try (var files = Files.list(tempDir.resolve("sessions").resolve(SESSION_ID))) {
            assertEquals(List.of(LocalSessionStoreAdapter.SESSION_FILE),
                    files.map(p -> p.getFileName().toString()).toList());
        }
    }

    // ===== Edge Cases =====

    @Test
    void shouldRejectPathTraversal() {
        assertThrows(IllegalArgumentException.class, () -> adapter.loadMessages("../../etc"));
        assertThrows(IllegalArgumentException.class, () -> adapter.saveMessages("../escape", List.of()));
    }

    @Test
    void shouldRejectIdsResolvingToSessionsRoot() {
        assertThrows(IllegalArgumentException.class, () -> adapter.saveMessages(".", List.of()));
        assertThrows(IllegalArgumentException.class, () -> adapter.sessionFile("nested/.."));
        assertFalse(Files.exists(tempDir.resolve("sessions").resolve(LocalSessionStoreAdapter.SESSION_FILE)));
    }

    @Test
    void shouldRejectBlankSessionId() {
        assertThrows(IllegalArgumentException.class, () -> adapter.sessionFile(" "));
        assertThrows(IllegalArgumentException.class, () -> adapter.sessionFile(null));
    }

    @Test
    void shouldFailOnCorruptFile() throws Exception {
        Path dir = tempDir.resolve("sessions").resolve(SESSION_ID);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(LocalSessionStoreAdapter.SESSION_FILE), "{not json");

        assertThrows(SessionPersistenceException.class, () -> adapter.loadMessages(SESSION_ID));
    }
}
