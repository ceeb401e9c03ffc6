package me.golemcore.agent.domain.loop;

import me.golemcore.agent.adapter.outbound.storage.InMemorySessionStoreAdapter;
import me.golemcore.agent.domain.context.HistoryCompressor;
import me.golemcore.agent.domain.context.ToolOutputSummarizer;
import me.golemcore.agent.domain.exception.SessionPersistenceException;
import me.golemcore.agent.domain.model.AgentRunResult;
import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.CompressionResult;
import me.golemcore.agent.domain.model.ExecutionEvent;
import me.golemcore.agent.domain.model.ExecutionEventType;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionCheckpoint;
import me.golemcore.agent.domain.model.SessionData;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SessionStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AgentSessionTest {

    private static final String SESSION_ID = "session-1";

    private LlmPort llmPort;
    private AgentProperties properties;
    private Clock clock;
    private InMemorySessionStoreAdapter store;
    private ObjectProvider<ConfirmationPort> confirmationProvider;
    private AgentSessionFactory factory;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        properties = new AgentProperties();
        properties.getLoop().setLlmInitialBackoffMs(0);
        properties.getLoop().setLlmMaxAttempts(1);
        properties.getScheduler().setSerialDelayMs(0);
        properties.getScheduler().setSummarizeOutput(false);
        properties.getContext().setAutoCompress(false);
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        store = new InMemorySessionStoreAdapter();
        confirmationProvider = mock(ObjectProvider.class);
        factory = factory(store);
    }

    @AfterEach
    void tearDown() {
        factory.shutdown();
    }

    private AgentSessionFactory factory(SessionStorePort sessionStore) {
        return new AgentSessionFactory(new LlmCallExecutor(llmPort, properties),
                new HistoryCompressor(llmPort, properties, clock), new ToolOutputSummarizer(llmPort, properties),
                new ToolRegistry(List.of()), sessionStore, confirmationProvider, properties, clock,
                AutoConfiguration.objectMapper());
    }

    private static CompletableFuture<LlmResponse> answer(String content) {
        return CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).usage(LlmUsage.of(20, 5)).build());
    }

    private static Message stored(String id, String role, String content) {
        return Message.builder().id(id).role(role).content(content).timestamp(Instant.EPOCH).build();
    }

    private static List<Message> fourMessages() {
        return List.of(
                stored("m1", Message.ROLE_USER, "first question"),
                stored("m2", Message.ROLE_ASSISTANT, "first answer"),
                stored("m3", Message.ROLE_USER, "second question"),
                stored("m4", Message.ROLE_ASSISTANT, "second answer"));
    }

    @Test
    void shouldStartFreshWithoutStoredData() {
        AgentSession session = factory.open(SESSION_ID);

        assertTrue(session.getContext().getHistory().isEmpty());
        assertTrue(session.getPersistedMessages().isEmpty());
        assertFalse(session.isRunning());
    }

    @Test
    void shouldCompleteTurnAndPersistMessages() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(answer("Hello!"));
        AgentSession session = factory.open(SESSION_ID);
        List<ExecutionEventType> events = new CopyOnWriteArrayList<>();
        session.getStream().on(event -> events.add(event.type()));

        AgentRunResult result = session.run("hi");

        assertEquals(AgentRunResult.Status.COMPLETED, result.status());
        assertEquals("Hello!", result.content());
        assertEquals(ExecutionEventType.EXECUTION_START, events.get(0));
        assertEquals(ExecutionEventType.EXECUTION_COMPLETE, events.get(events.size() - 1));

        List<Message> persisted = store.loadMessages(SESSION_ID);
        assertEquals(2, persisted.size());
        assertEquals("hi", persisted.get(0).getContent());
        assertEquals("Hello!", persisted.get(1).getContent());
        assertNotNull(persisted.get(0).getId());
        assertEquals(2, session.getContext().getHistory().size());
    }

    @Test
    void shouldResumeStoredHistory() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(answer("Hello!"));
        factory.open(SESSION_ID).run("hi");

        AgentSession resumed = factory.open(SESSION_ID);

        assertEquals(2, resumed.getContext().getHistory().size());
        assertEquals(2, resumed.getPersistedMessages().size());
    }

    @Test
    void shouldResumeFromCheckpointWithSummaryAndTail() {
        SessionCheckpoint checkpoint = SessionCheckpoint.builder()
                .summary("User asked two questions.")
                .loadAfterMessageId("m2")
                .stats(SessionCheckpoint.Stats.builder().totalCost(1.5).totalInputTokens(300).build())
                .build();
        store.saveSessionData(SessionData.builder()
                .sessionId(SESSION_ID)
                .messages(fourMessages())
                .checkpoint(checkpoint)
                .build());

        AgentSession session = factory.open(SESSION_ID);

        List<Message> history = session.getContext().getHistory();
        assertEquals(3, history.size());
        assertEquals(Message.ROLE_USER, history.get(0).getRole());
        assertTrue(history.get(0).getContent().startsWith("[Previous conversation summary]"));
        assertTrue(history.get(0).getContent().endsWith("User asked two questions."));
        assertEquals("m3", history.get(1).getId());
        assertEquals("m4", history.get(2).getId());
        assertEquals(1.5, session.getContext().getCumulativeStats().getTotalCost(), 0.0001);
        assertEquals(4, session.getPersistedMessages().size());
    }

    @Test
    void shouldDiscardCheckpointWhenAnchorIsMissing() {
        store.saveSessionData(SessionData.builder()
                .sessionId(SESSION_ID)
                .messages(fourMessages())
                .checkpoint(SessionCheckpoint.builder().summary("stale").loadAfterMessageId("gone").build())
                .build());

        AgentSession session = factory.open(SESSION_ID);

        assertEquals(4, session.getContext().getHistory().size());
        assertTrue(store.loadCheckpoint(SESSION_ID).isEmpty());
    }

    @Test
    void shouldArchiveInputWhenLlmFails() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("401 Unauthorized")));
        AgentSession session = factory.open(SESSION_ID);
        List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
        session.getStream().on(events::add);

        AgentRunResult result = session.run("hi");

        assertEquals(AgentRunResult.FailureKind.LLM_FAILURE, result.failureKind());
        assertEquals(ExecutionEventType.EXECUTION_ERROR, events.get(events.size() - 1).type());
        List<Message> persisted = store.loadMessages(SESSION_ID);
        assertEquals(1, persisted.size());
        assertEquals("hi", persisted.get(0).getContent());
    }

    @Test
    void shouldCancelTurnOnAbort() {
        AtomicReference<AgentSession> sessionRef = new AtomicReference<>();
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(inv -> {
            sessionRef.get().abort("user pressed escape");
            return new CompletableFuture<LlmResponse>();
        });
        AgentSession session = factory.open(SESSION_ID);
        sessionRef.set(session);
        List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
        session.getStream().on(events::add);

        AgentRunResult result = session.run("do something long");

        assertEquals(AgentRunResult.Status.CANCELLED, result.status());
        ExecutionEvent last = events.get(events.size() - 1);
        assertEquals(ExecutionEventType.EXECUTION_CANCEL, last.type());
        assertEquals("user pressed escape", last.getString("reason"));
        assertEquals(1, store.loadMessages(SESSION_ID).size());
        assertFalse(session.isRunning());
    }

    @Test
    void shouldRejectConcurrentRun() {
        AtomicReference<AgentSession> sessionRef = new AtomicReference<>();
        AtomicReference<Exception> nested = new AtomicReference<>();
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(inv -> {
            assertTrue(sessionRef.get().isRunning());
            try {
                sessionRef.get().run("second");
            } catch (IllegalStateException e) {
                nested.set(e);
            }
            return answer("first done");
        });
        AgentSession session = factory.open(SESSION_ID);
        sessionRef.set(session);

        AgentRunResult result = session.run("first");

        assertEquals(AgentRunResult.Status.COMPLETED, result.status());
        assertInstanceOf(IllegalStateException.class, nested.get());
        assertEquals(2, store.loadMessages(SESSION_ID).size());
    }

    @Test
    void shouldRejectCompressWhileRunning() {
        AtomicReference<AgentSession> sessionRef = new AtomicReference<>();
        AtomicReference<Exception> nested = new AtomicReference<>();
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(inv -> {
            try {
                sessionRef.get().compress();
            } catch (IllegalStateException e) {
                nested.set(e);
            }
            return answer("ok");
        });
        AgentSession session = factory.open(SESSION_ID);
        sessionRef.set(session);

        session.run("hi");

        assertInstanceOf(IllegalStateException.class, nested.get());
    }

    @Test
    void shouldCompressOnDemandAndResumeFromCheckpoint() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(
                answer("first answer"),
                answer("second answer"),
                answer("<summary>Two questions were answered.</summary>"));
        AgentSession session = factory.open(SESSION_ID);
        session.run("first question");
        session.run("second question");

        CompressionResult result = session.compress();

        assertTrue(result.compressed());
        SessionCheckpoint checkpoint = store.loadCheckpoint(SESSION_ID).orElseThrow();
        assertEquals("Two questions were answered.", checkpoint.getSummary());
        List<Message> persisted = store.loadMessages(SESSION_ID);
        assertEquals(4, persisted.size());
        int anchor = persisted.stream().map(Message::getId).toList().indexOf(checkpoint.getLoadAfterMessageId());
        assertTrue(anchor >= 1 && anchor < 3);

        AgentSession resumed = factory.open(SESSION_ID);
        List<Message> history = resumed.getContext().getHistory();
        assertEquals(persisted.size() - anchor, history.size());
        assertEquals(persisted.get(anchor + 1).getId(), history.get(1).getId());
        assertEquals("second answer", history.get(history.size() - 1).getContent());
    }

    @Test
    void shouldReportPersistenceFailure() {
        SessionStorePort failingStore = mock(SessionStorePort.class);
        when(failingStore.loadSessionData(anyString())).thenReturn(Optional.empty());
        doThrow(new SessionPersistenceException("disk full")).when(failingStore).saveMessages(anyString(), anyList());
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(answer("Hello!"));
        AgentSessionFactory failingFactory = factory(failingStore);
        try {
            AgentSession session = failingFactory.open(SESSION_ID);
            List<ExecutionEventType> events = new CopyOnWriteArrayList<>();
            session.getStream().on(event -> events.add(event.type()));

            AgentRunResult result = session.run("hi");

            assertEquals(AgentRunResult.Status.FAILED, result.status());
            assertEquals(AgentRunResult.FailureKind.PERSISTENCE_FAILURE, result.failureKind());
            assertEquals("Hello!", result.content());
            assertTrue(events.contains(ExecutionEventType.EXECUTION_ERROR));
            assertFalse(events.contains(ExecutionEventType.EXECUTION_COMPLETE));
        } finally {
            failingFactory.shutdown();
        }
    }

    @Test
    void shouldRejectRunAfterDispose() {
        AgentSession session = factory.open(SESSION_ID);
        session.getStream().on(event -> {
        });

        session.dispose();

        assertEquals(0, session.getStream().getListenerCount());
        assertThrows(IllegalStateException.class, () -> session.run("hi"));
    }

    @Test
    void shouldExposeApprovalMode() {
        AgentSession session = factory.create(SESSION_ID, null);

        assertEquals(ApprovalMode.DEFAULT, session.getApprovalMode());
        session.setApprovalMode(ApprovalMode.YOLO);
        assertEquals(ApprovalMode.YOLO, session.getApprovalMode());
    }

    @Test
    void shouldUseConfirmationPortFromContext() {
        when(confirmationProvider.getIfAvailable()).thenReturn(null);

        AgentSession session = factory.create(SESSION_ID);

        assertNotNull(session.getScheduler());
        verify(confirmationProvider).getIfAvailable();
        assertEquals(new ArrayList<>(), new ArrayList<>(session.getPersistedMessages()));
    }
}
