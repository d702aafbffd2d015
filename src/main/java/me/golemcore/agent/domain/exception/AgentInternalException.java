package me.golemcore.agent.domain.exception;

/**
 * A broken engine invariant.
 */
public class AgentInternalException extends AgentException {

    public AgentInternalException(String detail) {
        super(detail);
    }
}
