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

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.tool.ToolExecutionContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability contract every tool exposes to the scheduler. Optional
 * capabilities are separate interfaces: {@link ReadOnlyChecker} and
 * {@link ConfirmationRequirer}.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition (name, description, JSON schema of parameters)
     * advertised to the LLM.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with already-parsed arguments.
     *
     * @param parameters
     *            arguments parsed from the model's tool call
     * @param context
     *            call id, cancellation signal and progress sink
     * @return future completing with the tagged result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Category shown in execution events (e.g. "read", "edit", "exec").
     */
    default String getCategory() {
        return "other";
    }
}
