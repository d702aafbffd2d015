package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * A tool as the engine sees it: definition, retry budget and an invoke entry
 * point, captured once at registration.
 *
 * @param <D>
 *            dependency type
 */
public final class RegisteredTool<D> {

    private final ToolDefinition definition;
    private final int maxRetries;
    private final AgentTool<D> tool;

    RegisteredTool(AgentTool<D> tool) {
        this.definition = tool.getDefinition();
        this.maxRetries = Math.max(0, tool.getMaxRetries());
        this.tool = tool;
    }

    public String getName() {
        return definition.getName();
    }

    public ToolDefinition getDefinition() {
        return definition;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public CompletableFuture<ToolOutcome> invoke(AgentRunContext<D> context, String argumentsJson) {
        return tool.invoke(context, argumentsJson);
    }
}
