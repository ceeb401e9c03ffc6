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

package me.golemcore.agent.port.outbound;

import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.model.ConfirmOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking the user to approve a side-effecting tool call. The scheduler
 * blocks on the returned future; presentation layers complete it when the user
 * answers.
 */
public interface ConfirmationPort {

    /**
     * Request confirmation for a tool call.
     *
     * @param callId
     *            the tool call awaiting approval
     * @param toolName
     *            the tool requesting confirmation
     * @param details
     *            what is being confirmed
     * @return future completing with the user's decision
     */
    CompletableFuture<ConfirmOutcome> requestConfirmation(String callId, String toolName, ConfirmDetails details);

    /**
     * Check if someone is able to answer right now.
     */
    default boolean isAvailable() {
        return true;
    }
}
