package com.trenddigest.core.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Runs an attempt function until it succeeds, fails fatally, or the policy's attempt budget runs out.
 * A retryable outcome's backoff is waited out before the next attempt; nothing is waited before the
 * first attempt or after the last one.
 */
public final class RetryExecutor {
    private static final Logger LOG = LogManager.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Attempt<T> {
        CallOutcome<T> call(int attemptIndex);
    }

    private final String label;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(String label, RetryPolicy policy, Sleeper sleeper) {
        this.label = label == null ? "call" : label;
        this.policy = policy;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * @return a SUCCESS outcome, or a FATAL one carrying the last failure reason. Never RETRYABLE.
     */
    public <T> CallOutcome<T> execute(Attempt<T> attempt) {
        int maxAttempts = policy.maxAttempts();
        CallOutcome<T> last = null;
        Duration pendingBackoff = Duration.ZERO;

        for (int i = 0; i < maxAttempts; i++) {
            if (i > 0 && !pendingBackoff.isZero()) {
                LOG.info("{} waiting {} ms before attempt {}/{}", label, pendingBackoff.toMillis(), i + 1, maxAttempts);
                try {
                    sleeper.sleep(pendingBackoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    String reason = "interrupted during backoff"
                            + (last == null ? "" : ", last error: " + last.reason);
                    return CallOutcome.fatal(reason, e);
                }
            }

            CallOutcome<T> outcome = attempt.call(i);
            if (outcome == null) {
                outcome = CallOutcome.retryable("attempt returned no outcome", Duration.ZERO);
            }

            if (outcome.isSuccess()) {
                if (i > 0) {
                    LOG.info("{} succeeded on attempt {}/{}", label, i + 1, maxAttempts);
                }
                return outcome;
            }
            if (outcome.isFatal()) {
                LOG.error("{} failed fatally on attempt {}/{}: {}", label, i + 1, maxAttempts, outcome.reason);
                return outcome;
            }

            LOG.warn("{} attempt {}/{} failed: {}", label, i + 1, maxAttempts, outcome.reason);
            last = outcome;
            pendingBackoff = outcome.backoff;
        }

        String lastReason = last == null ? "no attempt made" : last.reason;
        LOG.error("{} gave up after {} attempts, last error: {}", label, maxAttempts, lastReason);
        return CallOutcome.fatal(
                "gave up after " + maxAttempts + " attempts: " + lastReason,
                last == null ? null : last.cause
        );
    }
}
