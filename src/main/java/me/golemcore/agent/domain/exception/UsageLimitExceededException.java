package me.golemcore.agent.domain.exception;

import lombok.Getter;
import me.golemcore.agent.domain.model.UsageLimitKind;

@Getter
public class UsageLimitExceededException extends AgentException {

    private final UsageLimitKind kind;
    private final long used;
    private final long limit;

    public UsageLimitExceededException(UsageLimitKind kind, long used, long limit) {
        super("Usage limit exceeded for " + kind.getLabel() + ": used " + used + ", limit " + limit);
        this.kind = kind;
        this.used = used;
        this.limit = limit;
    }
}
