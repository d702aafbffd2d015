package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.UsageLimitExceededException;
import me.golemcore.agent.domain.model.Usage;
import me.golemcore.agent.domain.model.UsageLimitKind;
import me.golemcore.agent.domain.model.UsageLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UsageLimiterTest {

    private RunState<Void> state;

    @BeforeEach
    void setUp() {
        state = RunState.start(null, Instant.parse("2026-02-14T00:00:00Z"));
    }

    @Test
    void shouldAllowEverythingWithoutLimits() {
        UsageLimiter limiter = new UsageLimiter(UsageLimits.NONE);
        for (int i = 0; i < 50; i++) {
            state.recordModelCall(Usage.of(1_000, 1_000));
            state.recordToolCall();
        }

        assertDoesNotThrow(() -> limiter.checkBeforeRequest(state));
        assertDoesNotThrow(() -> limiter.checkBeforeToolCall(state));
    }

    @Test
    void shouldStopRequestsAtLimit() {
        UsageLimiter limiter = new UsageLimiter(UsageLimits.builder().maxRequests(2).build());
        state.recordModelCall(Usage.ZERO);
        limiter.checkBeforeRequest(state);
        state.recordModelCall(Usage.ZERO);

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> limiter.checkBeforeRequest(state));

        assertEquals(UsageLimitKind.REQUESTS, error.getKind());
        assertEquals(2, error.getUsed());
        assertEquals(2, error.getLimit());
    }

    @Test
    void shouldAllowTokensUpToLimitAndFailAbove() {
        UsageLimiter limiter = new UsageLimiter(UsageLimits.builder().maxTotalTokens(100).build());
        state.recordModelCall(Usage.of(60, 40));

        assertDoesNotThrow(() -> limiter.checkBeforeRequest(state));

        state.recordModelCall(Usage.of(1, 0));
        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> limiter.checkBeforeRequest(state));
        assertEquals(UsageLimitKind.TOTAL_TOKENS, error.getKind());
    }

    @Test
    void shouldCheckInputAndOutputTokensSeparately() {
        UsageLimiter limiter = new UsageLimiter(UsageLimits.builder().maxOutputTokens(10).build());
        state.recordModelCall(Usage.of(500, 11));

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> limiter.checkBeforeRequest(state));

        assertEquals(UsageLimitKind.OUTPUT_TOKENS, error.getKind());
    }

    @Test
    void shouldStopToolCallsAtLimit() {
        UsageLimiter limiter = new UsageLimiter(UsageLimits.builder().maxToolCalls(1).build());
        limiter.checkBeforeToolCall(state);
        state.recordToolCall();

        UsageLimitExceededException error = assertThrows(UsageLimitExceededException.class,
                () -> limiter.checkBeforeToolCall(state));

        assertEquals(UsageLimitKind.TOOL_CALLS, error.getKind());
    }
}
