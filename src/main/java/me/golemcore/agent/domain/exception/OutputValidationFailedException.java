package me.golemcore.agent.domain.exception;

import lombok.Getter;

@Getter
public class OutputValidationFailedException extends AgentException {

    private final int attempts;

    public OutputValidationFailedException(int attempts, String lastFeedback) {
        super("Output still invalid after " + attempts + " validation retries: " + lastFeedback);
        this.attempts = attempts;
    }
}
