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

/**
 * Classification of tool call failures.
 */
public enum ToolFailureKind {

    /**
     * Arguments could not be parsed or failed tool-side validation.
     */
    INVALID_ARGUMENTS,

    /**
     * The requested tool is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * The user declined the confirmation prompt, or no one was there to ask.
     */
    CONFIRMATION_DENIED,

    /**
     * A policy (workspace sandbox, blocked command) rejected the call.
     */
    POLICY_DENIED,

    /**
     * Execution was cancelled by an abort.
     */
    CANCELLED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED
}
