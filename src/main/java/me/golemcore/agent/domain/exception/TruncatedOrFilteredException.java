package me.golemcore.agent.domain.exception;

import lombok.Getter;
import me.golemcore.agent.domain.model.StopReason;

@Getter
public class TruncatedOrFilteredException extends AgentException {

    private final StopReason stopReason;

    public TruncatedOrFilteredException(StopReason stopReason) {
        super(stopReason == StopReason.MAX_TOKENS
                ? "Model output was truncated by the token limit"
                : "Model output was blocked by the content filter");
        this.stopReason = stopReason;
    }
}
