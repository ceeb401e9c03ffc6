package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreAdapterTest {

    private static final String SESSION_ID = "s1";

    private InMemorySessionStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemorySessionStoreAdapter();
    }

    @Test
    void shouldStoreMessagesAndCheckpointTogether() {
        adapter.saveMessages(SESSION_ID, List.of(Message.user("hi")));
        adapter.saveCheckpoint(SESSION_ID, SessionCheckpoint.builder().summary("s").loadAfterMessageId("x").build());

        SessionData data = adapter.loadSessionData(SESSION_ID).orElseThrow();
        assertEquals(1, data.getMessages().size());
        assertEquals("s", data.getCheckpoint().getSummary());

        adapter.deleteCheckpoint(SESSION_ID);
        assertTrue(adapter.loadCheckpoint(SESSION_ID).isEmpty());
        assertEquals(1, adapter.loadMessages(SESSION_ID).size());
    }

    @Test
    void shouldCopyOnSaveAndLoad() {
        List<Message> messages = new ArrayList<>(List.of(Message.user("hi")));
        adapter.saveMessages(SESSION_ID, messages);
        messages.add(Message.user("later"));

        List<Message> loaded = adapter.loadMessages(SESSION_ID);
        loaded.clear();

        assertEquals(1, adapter.loadMessages(SESSION_ID).size());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(adapter.loadMessages("nope").isEmpty());
        assertTrue(adapter.loadSessionData("nope").isEmpty());
        assertTrue(adapter.loadCheckpoint("nope").isEmpty());
    }
}
