package me.golemcore.agent.domain.model;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff policy for model calls. Immutable and safe to share across runs.
 *
 * <p>
 * {@code delay(attempt) = min(maxDelay, initialDelay * multiplier^(attempt - 1))}
 * with a uniform jitter of {@code +/- jitter} (a fraction of the base delay),
 * clamped to {@code [0, maxDelay]}. Attempt numbers start at 1; the wait
 * before attempt {@code k} is {@code delay(k - 1)}, so the first attempt never
 * waits.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final RetryPolicy NONE = RetryPolicy.builder()
            .maxAttempts(1)
            .initialDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .multiplier(1.0)
            .jitter(0.0)
            .retryableErrors(EnumSet.noneOf(RetryableErrorKind.class))
            .build();

    public static final RetryPolicy DEFAULT = RetryPolicy.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .jitter(0.1)
            .retryableErrors(EnumSet.allOf(RetryableErrorKind.class))
            .build();

    public static final RetryPolicy AGGRESSIVE = RetryPolicy.builder()
            .maxAttempts(5)
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.5)
            .jitter(0.2)
            .retryableErrors(EnumSet.allOf(RetryableErrorKind.class))
            .build();

    int maxAttempts;
    Duration initialDelay;
    Duration maxDelay;
    double multiplier;
    double jitter;
    Set<RetryableErrorKind> retryableErrors;

    public boolean allows(RetryableErrorKind kind) {
        return retryableErrors != null && retryableErrors.contains(kind);
    }

    public Duration delay(int attempt) {
        return delay(attempt, ThreadLocalRandom.current());
    }

    public Duration delay(int attempt, Random random) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        double capMillis = maxDelay.toMillis();
        double base = Math.min(capMillis, initialDelay.toMillis() * Math.pow(multiplier, attempt - 1));
        double jittered = base;
        if (jitter > 0) {
            jittered = base * (1 + jitter * (2 * random.nextDouble() - 1));
        }
        long millis = (long) Math.max(0, Math.min(capMillis, jittered));
        return Duration.ofMillis(millis);
    }

    /**
     * Wait before the next attempt when the provider suggested one: at least
     * the hint, never above {@code maxDelay}.
     */
    public Duration delay(int attempt, Duration retryAfter) {
        Duration computed = delay(attempt);
        if (retryAfter == null || retryAfter.compareTo(computed) <= 0) {
            return computed;
        }
        return retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
    }
}
