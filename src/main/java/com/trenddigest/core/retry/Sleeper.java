package com.trenddigest.core.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
