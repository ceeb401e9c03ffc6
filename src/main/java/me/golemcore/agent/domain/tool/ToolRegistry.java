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

package me.golemcore.agent.domain.tool;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ReadOnlyChecker;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-indexed lookup of available tools.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        if (toolComponents != null) {
            for (ToolComponent tool : toolComponents) {
                if (tool.isEnabled()) {
                    register(tool);
                } else {
                    log.debug("[Tools] Skipping disabled tool {}", tool.getToolName());
                }
            }
        }
    }

    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        ToolComponent previous = tools.put(name, tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool {} registered twice, replacing {}", name, previous.getClass().getSimpleName());
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    public void unregister(String name) {
        tools.remove(name);
    }

    public Optional<ToolComponent> get(String name) {
        return name != null ? Optional.ofNullable(tools.get(name)) : Optional.empty();
    }

    public boolean has(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Unknown tools and tools without a read-only marker count as
     * side-effecting.
     */
    public boolean isReadOnly(String name) {
        return get(name).map(ToolRegistry::isReadOnly).orElse(false);
    }

    public static boolean isReadOnly(ToolComponent tool) {
        return tool instanceof ReadOnlyChecker checker && checker.isReadOnly();
    }

    public List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        definitions.sort((a, b) -> a.getName().compareTo(b.getName()));
        return definitions;
    }

    public int size() {
        return tools.size();
    }
}
