package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.UsageLimitExceededException;
import me.golemcore.agent.domain.model.Usage;
import me.golemcore.agent.domain.model.UsageLimitKind;
import me.golemcore.agent.domain.model.UsageLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces {@link UsageLimits} against a run's counters. Token ceilings fail
 * once usage goes above the limit; request and tool-call ceilings fail before
 * the call that would go above it.
 */
public class UsageLimiter {

    private static final Logger log = LoggerFactory.getLogger(UsageLimiter.class);

    private final UsageLimits limits;

    public UsageLimiter(UsageLimits limits) {
        this.limits = limits != null ? limits : UsageLimits.NONE;
    }

    public void checkBeforeRequest(RunState<?> state) {
        if (!limits.hasAny()) {
            return;
        }
        Usage usage = state.getUsage();
        checkTokens(UsageLimitKind.INPUT_TOKENS, usage.getInputTokens(), limits.getMaxInputTokens());
        checkTokens(UsageLimitKind.OUTPUT_TOKENS, usage.getOutputTokens(), limits.getMaxOutputTokens());
        checkTokens(UsageLimitKind.TOTAL_TOKENS, usage.getTotalTokens(), limits.getMaxTotalTokens());
        checkCount(UsageLimitKind.REQUESTS, state.getRequestCount(), limits.getMaxRequests());
    }

    public void checkBeforeToolCall(RunState<?> state) {
        checkCount(UsageLimitKind.TOOL_CALLS, state.getToolCallCount(), limits.getMaxToolCalls());
    }

    private static void checkTokens(UsageLimitKind kind, int used, Integer limit) {
        if (limit != null && used > limit) {
            fail(kind, used, limit);
        }
    }

    private static void checkCount(UsageLimitKind kind, int used, Integer limit) {
        if (limit != null && used >= limit) {
            fail(kind, used, limit);
        }
    }

    private static void fail(UsageLimitKind kind, int used, int limit) {
        log.warn("[AgentLoop] Usage limit hit: {} used {}, limit {}", kind.getLabel(), used, limit);
        throw new UsageLimitExceededException(kind, used, limit);
    }
}
