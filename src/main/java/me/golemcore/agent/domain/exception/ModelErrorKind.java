package me.golemcore.agent.domain.exception;

/**
 * Failure classes a {@code ModelPort} implementation reports through
 * {@link ModelCallException}.
 */
public enum ModelErrorKind {
    RATE_LIMITED,
    SERVER_ERROR,
    NETWORK_ERROR,
    AUTHENTICATION,
    INVALID_REQUEST,
    CONTENT_FILTERED,
    CONTEXT_LENGTH_EXCEEDED,
    DECODING,
    UNSUPPORTED;

    public boolean isTransient() {
        return this == RATE_LIMITED || this == SERVER_ERROR || this == NETWORK_ERROR;
    }
}
