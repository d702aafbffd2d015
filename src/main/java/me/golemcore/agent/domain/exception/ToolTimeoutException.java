package me.golemcore.agent.domain.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A tool did not finish within the configured timeout. Ends the run, unlike an
 * ordinary tool failure.
 */
@Getter
public class ToolTimeoutException extends AgentException {

    private final String toolName;
    private final Duration timeout;

    public ToolTimeoutException(String toolName, Duration timeout) {
        super("Tool " + toolName + " timed out after " + timeout.toMillis() + " ms");
        this.toolName = toolName;
        this.timeout = timeout;
    }
}
