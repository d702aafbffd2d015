package me.golemcore.agent.domain.exception;

/**
 * The model layer broke its contract, e.g. an end-of-turn with neither output
 * nor tool calls.
 */
public class UnexpectedModelBehaviorException extends AgentException {

    public UnexpectedModelBehaviorException(String detail) {
        super(detail);
    }
}
