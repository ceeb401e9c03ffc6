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

package me.golemcore.agent.domain.execution;

/**
 * Payload keys shared by producers and consumers of execution events.
 */
public final class EventPayload {

    public static final String CALL_ID = "callId";
    public static final String TOOL_NAME = "toolName";
    public static final String CATEGORY = "category";
    public static final String PARAMS_SUMMARY = "paramsSummary";
    public static final String THINKING = "thinking";
    public static final String DETAILS = "details";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String EXCEPTIONAL = "exceptional";
    public static final String REASON = "reason";
    public static final String DURATION_MS = "durationMs";
    public static final String DELTA = "delta";
    public static final String CONTENT = "content";
    public static final String SUB_TOOL_CALL = "subToolCall";
    public static final String INPUT_TOKENS = "inputTokens";
    public static final String OUTPUT_TOKENS = "outputTokens";
    public static final String TOTAL_TOKENS = "totalTokens";
    public static final String COST = "cost";
    public static final String LOOP_COUNT = "loopCount";
    public static final String TOOL_CALL_COUNT = "toolCallCount";
    public static final String ELAPSED_MS = "elapsedMs";
    public static final String MESSAGE_COUNT = "messageCount";
    public static final String ORIGINAL_TOKENS = "originalTokens";
    public static final String COMPRESSED_TOKENS = "compressedTokens";
    public static final String COMPRESSED = "compressed";
    public static final String SAVED_PERCENTAGE = "savedPercentage";
    public static final String TRIGGER = "trigger";

    private EventPayload() {
    }
}
