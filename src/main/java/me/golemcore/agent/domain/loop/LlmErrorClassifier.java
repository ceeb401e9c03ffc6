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

package me.golemcore.agent.domain.loop;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps LLM call failures to stable error codes and tells which of them are
 * worth retrying.
 */
public final class LlmErrorClassifier {

    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String TIMEOUT = "llm.request.timeout";
    public static final String SERVER_ERROR = "llm.server_error";
    public static final String NETWORK = "llm.network";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String UNSUPPORTED = "llm.unsupported";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final Set<String> TRANSIENT_CODES = Set.of(RATE_LIMIT, TIMEOUT, SERVER_ERROR, NETWORK);

    private LlmErrorClassifier() {
    }

    /**
     * Walks the cause chain and returns the first recognizable code.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    public static boolean isTransient(Throwable throwable) {
        return isTransientCode(classifyFromThrowable(throwable));
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof TimeoutException || throwable instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (throwable instanceof ConnectException) {
            return NETWORK;
        }
        if (throwable instanceof UnsupportedOperationException) {
            return UNSUPPORTED;
        }
        if (throwable instanceof IOException) {
            return NETWORK;
        }
        return UNKNOWN;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("rate limit") || normalized.contains("rate_limit")
                || normalized.contains("too many requests") || normalized.contains("429")) {
            return RATE_LIMIT;
        }
        if (normalized.contains("timeout") || normalized.contains("timed out")) {
            return TIMEOUT;
        }
        if (normalized.contains("overloaded") || normalized.contains("internal server error")
                || normalized.contains("bad gateway") || normalized.contains("service unavailable")
                || normalized.contains(" 500") || normalized.contains(" 502") || normalized.contains(" 503")) {
            return SERVER_ERROR;
        }
        if (normalized.contains("connection reset") || normalized.contains("connection refused")) {
            return NETWORK;
        }
        if (normalized.contains("unauthorized") || normalized.contains("invalid api key")
                || normalized.contains("401")) {
            return AUTHENTICATION;
        }
        if (normalized.contains("invalid request") || normalized.contains("bad request")) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }
}
