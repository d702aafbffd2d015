package me.golemcore.agent.domain.exception;

import lombok.Getter;

/**
 * The model declined to answer. Never retried.
 */
@Getter
public class ModelRefusedException extends AgentException {

    private final String reason;

    public ModelRefusedException(String reason) {
        super("Model refused: " + reason);
        this.reason = reason;
    }
}
