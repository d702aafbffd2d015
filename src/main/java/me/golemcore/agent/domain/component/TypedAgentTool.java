package me.golemcore.agent.domain.component;


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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.exception.ToolArgumentsException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Base class for tools with a typed argument object. Arguments are decoded with
 * Jackson before {@link #call} runs; results that are not a {@link ToolOutcome}
 * or a {@code String} are encoded as JSON.
 *
 * @param <D>
 *            dependency type
 * @param <A>
 *            argument type
 */
public abstract class TypedAgentTool<D, A> implements AgentTool<D> {

    private final ToolDefinition definition;
    private final Class<A> argumentsType;
    private final ObjectMapper objectMapper;

    protected TypedAgentTool(ToolDefinition definition, Class<A> argumentsType, ObjectMapper objectMapper) {
        this.definition = definition;
        this.argumentsType = argumentsType;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolOutcome> invoke(AgentRunContext<D> context, String argumentsJson) {
        A arguments;
        try {
            String json = argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson;
            arguments = objectMapper.readValue(json, argumentsType);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(ToolOutcome.failure(new ToolArgumentsException(
                    "Invalid arguments for " + definition.getName() + ": " + e.getOriginalMessage(), e)));
        }
        return call(context, arguments).thenApply(this::toOutcome);
    }

    /**
     * Executes the tool. May complete with a {@link ToolOutcome} to request a
     * retry or a deferral; any other value is a success.
     */
    protected abstract CompletableFuture<Object> call(AgentRunContext<D> context, A arguments);

    private ToolOutcome toOutcome(Object result) {
        if (result instanceof ToolOutcome outcome) {
            return outcome;
        }
        if (result == null) {
            return ToolOutcome.success("");
        }
        if (result instanceof String text) {
            return ToolOutcome.success(text);
        }
        try {
            return ToolOutcome.success(objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            return ToolOutcome.failure(new ToolExecutionException(
                    "Failed to encode result of " + definition.getName(), e));
        }
    }
}
