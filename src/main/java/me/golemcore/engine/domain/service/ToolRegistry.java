package me.golemcore.engine.domain.service;

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

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps tool names to executable tools and exposes their invocation schemas.
 * Disabled tools stay registered but are invisible to lookups and schema
 * listings.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void register(ToolComponent tool) {
        tools.put(tool.getToolName(), tool);
        log.debug("[Tools] Registered tool: {}", tool.getToolName());
    }

    public void unregister(Collection<String> toolNames) {
        if (toolNames == null) {
            return;
        }
        for (String name : toolNames) {
            tools.remove(name);
        }
        log.debug("[Tools] Unregistered tools: {}", toolNames);
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public Optional<ToolComponent> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name)).filter(ToolComponent::isEnabled);
    }

    /**
     * Schemas of all enabled tools, sorted by name so requests are stable.
     */
    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted((left, right) -> left.getName().compareTo(right.getName()))
                .toList();
    }

    /**
     * Invokes a registered tool.
     *
     * @throws IllegalArgumentException
     *             if no enabled tool has the given name
     */
    public CompletableFuture<ToolResult> invoke(String name, Map<String, Object> arguments) {
        ToolComponent tool = get(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool '" + name + "'"));
        return tool.execute(arguments);
    }
}
