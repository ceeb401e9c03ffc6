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

package me.golemcore.agent.domain.model;

import lombok.Builder;

/**
 * Outcome of one agent turn as seen by the caller.
 */
@Builder
public record AgentRunResult(Status status, String content, FailureKind failureKind, String error, int loopCount,
        long inputTokens, long outputTokens, double cost) {

    public enum Status {
        COMPLETED, CANCELLED, FAILED
    }

    /**
     * Turn-level failures. Tool-level failures never surface here.
     */
    public enum FailureKind {
        CONTEXT_OVERFLOW, LLM_FAILURE, MAX_LOOPS, PERSISTENCE_FAILURE, INTERNAL
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    public static AgentRunResult failed(FailureKind kind, String error, int loopCount) {
        return AgentRunResult.builder()
                .status(Status.FAILED)
                .failureKind(kind)
                .error(error)
                .loopCount(loopCount)
                .build();
    }

    public static AgentRunResult cancelled(int loopCount) {
        return AgentRunResult.builder()
                .status(Status.CANCELLED)
                .loopCount(loopCount)
                .build();
    }
}
