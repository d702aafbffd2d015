package me.golemcore.agent.domain.exception;

/**
 * Thrown by an output validator to ask the model for another attempt. The
 * message is fed back to the model.
 */
public class ValidationRetryException extends AgentException {

    public ValidationRetryException(String message) {
        super(message);
    }
}
