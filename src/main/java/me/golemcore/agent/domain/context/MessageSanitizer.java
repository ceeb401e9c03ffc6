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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SanitizeResult;
import me.golemcore.agent.domain.model.ValidationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Enforces the tool-call pairing invariant over a message sequence.
 *
 * <p>
 * An assistant message with tool calls and the tool messages answering it form
 * one unit. A unit with any unanswered call is removed as a whole; tool
 * messages that do not answer a call of the surviving assistant message right
 * before their run are removed as orphans. Removals never fail the call, they
 * are reported in the {@link SanitizeResult} and logged.
 */
@Slf4j
public final class MessageSanitizer {

    static final String REASON_INCOMPLETE = "incomplete tool call unit";
    static final String REASON_PART_OF_INCOMPLETE = "response belongs to incomplete tool call unit";
    static final String REASON_ORPHAN = "orphan tool response";

    private MessageSanitizer() {
    }

    public static SanitizeResult sanitize(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return new SanitizeResult(new ArrayList<>(), false, 0, List.of());
        }

        Map<Integer, String> removals = new TreeMap<>();
        markIncompleteUnits(messages, removals);
        markOrphans(messages, removals);

        if (removals.isEmpty()) {
            return new SanitizeResult(new ArrayList<>(messages), false, 0, List.of());
        }

        List<Message> kept = new ArrayList<>(messages.size() - removals.size());
        for (int i = 0; i < messages.size(); i++) {
            if (!removals.containsKey(i)) {
                kept.add(messages.get(i));
            }
        }
        List<SanitizeResult.RemovedMessage> removed = new ArrayList<>(removals.size());
        for (Map.Entry<Integer, String> entry : removals.entrySet()) {
            removed.add(new SanitizeResult.RemovedMessage(entry.getKey(),
                    messages.get(entry.getKey()).getRole(), entry.getValue()));
        }

        log.warn("[Sanitizer] Removed {} message(s) to keep tool call pairing valid: {}", removed.size(), removed);
        return new SanitizeResult(kept, true, removed.size(), removed);
    }

    /**
     * Sanitizes an interrupted turn before it is archived. Same rules as
     * {@link #sanitize(List)}.
     */
    public static SanitizeResult sanitizeCurrentTurn(List<Message> turnMessages) {
        return sanitize(turnMessages);
    }

    /**
     * Reports pairing violations without modifying anything.
     */
    public static ValidationResult validate(List<Message> messages) {
        List<String> errors = new ArrayList<>();
        if (messages == null) {
            return new ValidationResult(true, errors);
        }

        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!message.isAssistantMessage() || !message.hasToolCalls()) {
                continue;
            }
            Set<String> missing = missingResponses(messages, i);
            if (!missing.isEmpty()) {
                errors.add("Message " + i + " (assistant): missing tool responses for " + missing);
            }
        }

        Set<String> open = new HashSet<>();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!message.isToolMessage()) {
                open = openedIds(message);
                continue;
            }
            String callId = message.getToolCallId();
            if (callId == null) {
                errors.add("Message " + i + " (tool): missing toolCallId");
            } else if (!open.remove(callId)) {
                errors.add("Message " + i + " (tool): orphan response for tool call " + callId);
            }
        }

        return new ValidationResult(errors.isEmpty(), errors);
    }

    private static void markIncompleteUnits(List<Message> messages, Map<Integer, String> removals) {
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (!message.isAssistantMessage() || !message.hasToolCalls()) {
                continue;
            }
            if (missingResponses(messages, i).isEmpty()) {
                continue;
            }
            removals.put(i, REASON_INCOMPLETE);
            Set<String> ids = callIds(message);
            for (int j = i + 1; j < messages.size() && messages.get(j).isToolMessage(); j++) {
                String callId = messages.get(j).getToolCallId();
                if (callId != null && ids.contains(callId)) {
                    removals.put(j, REASON_PART_OF_INCOMPLETE);
                }
            }
        }
    }

    /**
     * Walks the surviving messages; each run of tool messages may only answer the
     * calls of the assistant message right before it, once per call id.
     */
    private static void markOrphans(List<Message> messages, Map<Integer, String> removals) {
        Set<String> open = new HashSet<>();
        for (int i = 0; i < messages.size(); i++) {
            if (removals.containsKey(i)) {
                continue;
            }
            Message message = messages.get(i);
            if (!message.isToolMessage()) {
                open = openedIds(message);
                continue;
            }
            String callId = message.getToolCallId();
            if (callId == null || !open.remove(callId)) {
                removals.put(i, REASON_ORPHAN);
            }
        }
    }

    private static Set<String> missingResponses(List<Message> messages, int assistantIndex) {
        Set<String> missing = callIds(messages.get(assistantIndex));
        for (int j = assistantIndex + 1; j < messages.size() && messages.get(j).isToolMessage(); j++) {
            String callId = messages.get(j).getToolCallId();
            if (callId != null) {
                missing.remove(callId);
            }
        }
        return missing;
    }

    private static Set<String> openedIds(Message message) {
        if (message.isAssistantMessage() && message.hasToolCalls()) {
            return callIds(message);
        }
        return new HashSet<>();
    }

    private static Set<String> callIds(Message message) {
        Set<String> ids = new LinkedHashSet<>();
        for (Message.ToolCall call : message.getToolCalls()) {
            ids.add(call.getId());
        }
        return ids;
    }
}
