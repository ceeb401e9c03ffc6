package me.golemcore.agent.domain.context;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SanitizeResult;
import me.golemcore.agent.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageSanitizerTest {

    private static final String READ_FILE = "ReadFile";

    private static Message.ToolCall call(String id) {
        return Message.ToolCall.builder().id(id).name(READ_FILE).arguments("{}").build();
    }

    private static Message assistantWithCalls(String... ids) {
        List<Message.ToolCall> calls = new ArrayList<>();
        for (String id : ids) {
            calls.add(call(id));
        }
        return Message.assistant("", calls);
    }

    private static Message toolResponse(String id) {
        return Message.tool(id, READ_FILE, "result of " + id);
    }

    @Test
    void shouldKeepValidSequenceUntouched() {
        List<Message> messages = List.of(
                Message.user("read a and b"),
                assistantWithCalls("c1", "c2"),
                toolResponse("c1"),
                toolResponse("c2"),
                Message.assistant("done"));

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertFalse(result.sanitized());
        assertEquals(0, result.removedCount());
        assertEquals(messages, result.messages());
        assertTrue(MessageSanitizer.validate(messages).valid());
    }

    @Test
    void shouldRemoveIncompleteUnitAsWhole() {
        Message user = Message.user("read a and b");
        List<Message> messages = List.of(
                user,
                assistantWithCalls("c1", "c2"),
                toolResponse("c1"));

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertTrue(result.sanitized());
        assertEquals(2, result.removedCount());
        assertEquals(List.of(user), result.messages());
        assertEquals(MessageSanitizer.REASON_INCOMPLETE, result.removedMessages().get(0).reason());
        assertEquals(1, result.removedMessages().get(0).index());
        assertEquals(MessageSanitizer.REASON_PART_OF_INCOMPLETE, result.removedMessages().get(1).reason());
    }

    @Test
    void shouldRemoveAssistantWhoseResponsesAreAllMissing() {
        Message user = Message.user("hello");
        List<Message> messages = List.of(user, assistantWithCalls("c1"));

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertEquals(List.of(user), result.messages());
        assertEquals(1, result.removedCount());
        assertEquals(Message.ROLE_ASSISTANT, result.removedMessages().get(0).role());
    }

    @Test
    void shouldRemoveOrphanToolResponse() {
        Message user = Message.user("hi");
        Message answer = Message.assistant("hello");
        List<Message> messages = List.of(user, toolResponse("ghost"), answer);

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertEquals(List.of(user, answer), result.messages());
        assertEquals(MessageSanitizer.REASON_ORPHAN, result.removedMessages().get(0).reason());
        assertEquals(1, result.removedMessages().get(0).index());
    }

    @Test
    void shouldRemoveDuplicateResponseForSameCall() {
        List<Message> messages = List.of(
                Message.user("go"),
                assistantWithCalls("c1"),
                toolResponse("c1"),
                toolResponse("c1"));

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertEquals(3, result.messages().size());
        assertEquals(1, result.removedCount());
        assertEquals(3, result.removedMessages().get(0).index());
    }

    @Test
    void shouldTreatResponseAfterInterveningMessageAsOrphan() {
        List<Message> messages = List.of(
                Message.user("go"),
                assistantWithCalls("c1"),
                toolResponse("c1"),
                Message.user("again"),
                toolResponse("c1"));

        SanitizeResult result = MessageSanitizer.sanitize(messages);

        assertEquals(4, result.messages().size());
        assertEquals(4, result.removedMessages().get(0).index());
        assertEquals(MessageSanitizer.REASON_ORPHAN, result.removedMessages().get(0).reason());
    }

    @Test
    void shouldProduceValidOutputAndBeIdempotent() {
        List<Message> messages = List.of(
                Message.user("one"),
                assistantWithCalls("c1", "c2"),
                toolResponse("c2"),
                toolResponse("stray"),
                Message.user("two"),
                assistantWithCalls("c3"),
                toolResponse("c3"),
                Message.assistant("ok"),
                toolResponse("c3"),
                assistantWithCalls("c4"));

        SanitizeResult first = MessageSanitizer.sanitize(messages);
        SanitizeResult second = MessageSanitizer.sanitize(first.messages());

        assertTrue(MessageSanitizer.validate(first.messages()).valid());
        assertFalse(second.sanitized());
        assertEquals(first.messages(), second.messages());
    }

    @Test
    void shouldNotModifyInputList() {
        List<Message> messages = new ArrayList<>(List.of(Message.user("x"), assistantWithCalls("c1")));

        MessageSanitizer.sanitize(messages);

        assertEquals(2, messages.size());
    }

    @Test
    void shouldSanitizeInterruptedTurnWithSameRules() {
        Message user = Message.user("list files");
        List<Message> turn = List.of(user, assistantWithCalls("c1", "c2"), toolResponse("c1"));

        SanitizeResult result = MessageSanitizer.sanitizeCurrentTurn(turn);

        assertEquals(List.of(user), result.messages());
    }

    @Test
    void shouldReportMissingResponsesInValidation() {
        List<Message> messages = List.of(Message.user("x"), assistantWithCalls("c1"));

        ValidationResult result = MessageSanitizer.validate(messages);

        assertFalse(result.valid());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Message 1 (assistant): missing tool responses for"));
        assertTrue(result.errors().get(0).contains("c1"));
    }

    @Test
    void shouldReportOrphanAndMissingIdInValidation() {
        Message noId = Message.builder().role(Message.ROLE_TOOL).content("x").build();
        List<Message> messages = List.of(Message.user("x"), toolResponse("c9"), noId);

        ValidationResult result = MessageSanitizer.validate(messages);

        assertFalse(result.valid());
        assertEquals(List.of(
                "Message 1 (tool): orphan response for tool call c9",
                "Message 2 (tool): missing toolCallId"), result.errors());
    }

    @Test
    void shouldKeepCompleteListFilesExchange() {
        List<Message> history = List.of(
                Message.user("list files"),
                Message.assistant("", List.of(Message.ToolCall.builder().id("c1").name("ListFiles").build())),
                Message.tool("c1", "ListFiles", "[a.txt]"),
                Message.assistant("Found one file."));

        SanitizeResult result = MessageSanitizer.sanitize(history);

        assertEquals(history, result.messages());
        assertEquals(0, result.removedCount());
    }

    @Test
    void shouldDropListFilesCallWithoutResponse() {
        Message user = Message.user("list files");
        List<Message> history = List.of(
                user,
                Message.assistant("", List.of(Message.ToolCall.builder().id("c1").name("ListFiles").build())));

        SanitizeResult result = MessageSanitizer.sanitize(history);

        assertEquals(List.of(user), result.messages());
        assertEquals(1, result.removedCount());
    }

    // ===== Edge Cases =====

    @Test
    void shouldHandleNullAndEmpty() {
        assertTrue(MessageSanitizer.sanitize(null).messages().isEmpty());
        assertFalse(MessageSanitizer.sanitize(List.of()).sanitized());
        assertTrue(MessageSanitizer.validate(null).valid());
    }

    @Test
    void shouldKeepAssistantWithoutToolCalls() {
        List<Message> messages = List.of(Message.system("sys"), Message.user("q"), Message.assistant("a"));

        assertEquals(messages, MessageSanitizer.sanitize(messages).messages());
    }
}
