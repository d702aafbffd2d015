package me.golemcore.agent.domain.exception;

import lombok.Getter;

@Getter
public class ToolNotFoundException extends AgentException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }
}
