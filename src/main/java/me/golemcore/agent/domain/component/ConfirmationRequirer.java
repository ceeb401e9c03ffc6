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

package me.golemcore.agent.domain.component;

import me.golemcore.agent.domain.model.ApprovalMode;
import me.golemcore.agent.domain.model.ConfirmDetails;
import me.golemcore.agent.domain.tool.Allowlist;
import me.golemcore.agent.domain.tool.ToolExecutionContext;

import java.util.Map;
import java.util.Optional;

/**
 * Implemented by tools that decide on their own whether a call needs user
 * approval.
 */
public interface ConfirmationRequirer {

    /**
     * @param parameters
     *            parsed call arguments
     * @param mode
     *            active approval mode
     * @param context
     *            execution context of the pending call
     * @param allowlist
     *            durable "always allow" memory, which the tool may consult or
     *            update
     * @return details to show the user, or empty when no confirmation is needed
     */
    Optional<ConfirmDetails> shouldConfirmExecute(Map<String, Object> parameters, ApprovalMode mode,
            ToolExecutionContext context, Allowlist allowlist);
}
