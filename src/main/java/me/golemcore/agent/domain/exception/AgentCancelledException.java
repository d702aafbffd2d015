package me.golemcore.agent.domain.exception;

public class AgentCancelledException extends AgentException {

    public AgentCancelledException(String message) {
        super(message);
    }

    public AgentCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
