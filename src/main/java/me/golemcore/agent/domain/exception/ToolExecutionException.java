package me.golemcore.agent.domain.exception;

/**
 * Generic tool failure recorded as error content in the transcript.
 */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
