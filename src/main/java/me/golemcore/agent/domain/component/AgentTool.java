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

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * A tool the model can call. Tools expose their JSON Schema definition for
 * function calling and implement the execution logic.
 *
 * <p>
 * Implementations may keep internal state, but must synchronize it themselves:
 * one tool instance is shared by every run of an agent.
 *
 * @param <D>
 *            dependency type of the agent the tool is registered with
 */
public interface AgentTool<D> {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * How many times a {@code retry} outcome re-invokes the tool before the
     * call fails.
     */
    default int getMaxRetries() {
        return 1;
    }

    /**
     * Executes the tool with raw JSON arguments produced by the model.
     *
     * @param context
     *            run context; {@code getRetries()} counts earlier retry outcomes
     *            of this call
     * @param argumentsJson
     *            arguments exactly as the model sent them
     * @return a future containing the outcome of this attempt
     */
    CompletableFuture<ToolOutcome> invoke(AgentRunContext<D> context, String argumentsJson);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
