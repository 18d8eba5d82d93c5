package com.trenddigest.core.retry;

import java.time.Duration;

/**
 * How a failed remote call should be treated, and how long to wait before trying again.
 */
public enum FailureCategory {
    /** 429 / quota exhausted. Waits twice as long as a generic failure. */
    RATE_LIMITED(true, 2),
    /** 5xx, the remote side is temporarily down. */
    SERVER_UNAVAILABLE(true, 1),
    /** 4xx other than 429. The same request will never succeed. */
    CLIENT_ERROR(false, 0),
    /** Response arrived but carried no usable text. Retried at once. */
    EMPTY_RESPONSE(true, 0),
    /** Network noise and anything else not recognised. */
    UNCLASSIFIED(true, 1);

    private final boolean retryable;
    private final int delayFactor;

    FailureCategory(boolean retryable, int delayFactor) {
        this.retryable = retryable;
        this.delayFactor = delayFactor;
    }

    public boolean retryable() {
        return retryable;
    }

    /**
     * Wait before the attempt that follows {@code attemptIndex} (0-based): {@code baseDelay * (attemptIndex + 1) * factor}.
     */
    public Duration backoff(Duration baseDelay, int attemptIndex) {
        if (!retryable || delayFactor == 0 || baseDelay == null) {
            return Duration.ZERO;
        }
        return baseDelay.multipliedBy((long) (Math.max(0, attemptIndex) + 1) * delayFactor);
    }
}
