package me.golemcore.agent.domain.exception;

public class ToolArgumentsException extends AgentException {

    public ToolArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
