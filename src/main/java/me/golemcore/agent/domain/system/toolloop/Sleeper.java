package me.golemcore.agent.domain.system.toolloop;

import java.time.Duration;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
