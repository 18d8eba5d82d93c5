package com.trenddigest.core.retry;

import java.time.Duration;

/**
 * Attempt budget and base wait for one stage. Stateless; one instance serves every call.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
    }

    public static RetryPolicy of(int maxAttempts, long baseDelayMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(Math.max(0L, baseDelayMs)));
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO);
    }
}
