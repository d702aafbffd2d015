package me.golemcore.agent.domain.exception;

import lombok.Getter;

@Getter
public class IterationLimitExceededException extends AgentException {

    private final int iterations;

    public IterationLimitExceededException(int iterations) {
        super("Run exceeded the iteration limit of " + iterations);
        this.iterations = iterations;
    }
}
