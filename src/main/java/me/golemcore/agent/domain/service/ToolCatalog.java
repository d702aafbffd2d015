package me.golemcore.agent.domain.service;


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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of the tools of one agent, in registration order. Shared
 * read-only by every run.
 *
 * @param <D>
 *            dependency type
 */
@Slf4j
public final class ToolCatalog<D> {

    private static final String CHANNEL_MARKER = "<|";

    private final Map<String, RegisteredTool<D>> tools;

    public ToolCatalog(Collection<? extends AgentTool<D>> agentTools, String reservedName) {
        Map<String, RegisteredTool<D>> registry = new LinkedHashMap<>();
        for (AgentTool<D> tool : agentTools) {
            RegisteredTool<D> registered = new RegisteredTool<>(tool);
            String name = registered.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tool name must not be blank");
            }
            if (name.equals(reservedName)) {
                throw new IllegalArgumentException("Tool name '" + name + "' is reserved for the output tool");
            }
            if (registry.putIfAbsent(name, registered) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
        }
        this.tools = Collections.unmodifiableMap(registry);
        log.debug("[Tools] Registered tools: {}", tools.keySet());
    }

    public static <D> ToolCatalog<D> empty() {
        return new ToolCatalog<>(List.of(), null);
    }

    /**
     * Finds a tool by the name the model used. An exact match wins; otherwise
     * channel markers some models leak after the name ({@code search<|channel|>})
     * are stripped and the lookup is repeated.
     */
    public Optional<RegisteredTool<D>> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        RegisteredTool<D> exact = tools.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(tools.get(sanitizeToolName(name)));
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (RegisteredTool<D> tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public Collection<String> names() {
        return tools.keySet();
    }

    public int size() {
        return tools.size();
    }

    /**
     * Cuts a leaked channel marker off a tool name. Names without a marker are
     * only trimmed, so registered names like {@code fs.read} survive.
     */
    public static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        int marker = name.indexOf(CHANNEL_MARKER);
        String sanitized = marker >= 0 ? name.substring(0, marker).trim() : name.trim();
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
