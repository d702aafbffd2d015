package me.golemcore.agent.domain.exception;

import lombok.Getter;

@Getter
public class ToolRetriesExhaustedException extends AgentException {

    private final String toolName;
    private final int attempts;

    public ToolRetriesExhaustedException(String toolName, int attempts, String lastFeedback) {
        super("Tool " + toolName + " still asked for a retry after " + attempts + " attempts"
                + (lastFeedback != null ? ": " + lastFeedback : ""));
        this.toolName = toolName;
        this.attempts = attempts;
    }
}
