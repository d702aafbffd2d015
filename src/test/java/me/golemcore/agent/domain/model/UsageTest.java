package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class UsageTest {

    private static final Usage FIRST = Usage.builder()
            .inputTokens(100).outputTokens(20).cachedTokens(40).reasoningTokens(5).build();
    private static final Usage SECOND = Usage.builder()
            .inputTokens(7).outputTokens(3).cachedTokens(1).build();
    private static final Usage THIRD = Usage.of(50, 60);

    @Test
    void shouldSumEveryCounter() {
        Usage sum = FIRST.plus(SECOND);

        assertEquals(107, sum.getInputTokens());
        assertEquals(23, sum.getOutputTokens());
        assertEquals(41, sum.getCachedTokens());
        assertEquals(5, sum.getReasoningTokens());
        assertEquals(130, sum.getTotalTokens());
    }

    @Test
    void shouldBeAssociativeAndCommutative() {
        assertEquals(FIRST.plus(SECOND).plus(THIRD), FIRST.plus(SECOND.plus(THIRD)));
        assertEquals(FIRST.plus(SECOND), SECOND.plus(FIRST));
    }

    @Test
    void shouldTreatZeroAndNullAsIdentity() {
        assertEquals(FIRST, FIRST.plus(Usage.ZERO));
        assertEquals(FIRST, Usage.ZERO.plus(FIRST));
        assertSame(FIRST, FIRST.plus(null));
    }

    @Test
    void shouldExcludeCachedTokensFromEffectiveInput() {
        assertEquals(60, FIRST.getEffectiveInputTokens());
    }
}
