package com.trenddigest.core.retry;

import java.time.Duration;

/**
 * Result of one remote call attempt, or of a whole retry loop.
 */
public final class CallOutcome<T> {
    public enum Kind {
        SUCCESS,
        RETRYABLE,
        FATAL
    }

    public final Kind kind;
    public final T value;
    public final String reason;
    public final Duration backoff;
    public final Throwable cause;

    private CallOutcome(Kind kind, T value, String reason, Duration backoff, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.reason = reason == null ? "" : reason;
        this.backoff = backoff == null || backoff.isNegative() ? Duration.ZERO : backoff;
        this.cause = cause;
    }

    public static <T> CallOutcome<T> success(T value) {
        return new CallOutcome<>(Kind.SUCCESS, value, "", Duration.ZERO, null);
    }

    public static <T> CallOutcome<T> retryable(String reason, Duration backoff) {
        return new CallOutcome<>(Kind.RETRYABLE, null, reason, backoff, null);
    }

    public static <T> CallOutcome<T> retryable(String reason, Duration backoff, Throwable cause) {
        return new CallOutcome<>(Kind.RETRYABLE, null, reason, backoff, cause);
    }

    public static <T> CallOutcome<T> fatal(String reason) {
        return new CallOutcome<>(Kind.FATAL, null, reason, Duration.ZERO, null);
    }

    public static <T> CallOutcome<T> fatal(String reason, Throwable cause) {
        return new CallOutcome<>(Kind.FATAL, null, reason, Duration.ZERO, cause);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    @Override
    public String toString() {
        if (kind == Kind.SUCCESS) {
            return "SUCCESS";
        }
        if (kind == Kind.RETRYABLE) {
            return "RETRYABLE(" + reason + ", backoff=" + backoff.toMillis() + "ms)";
        }
        return "FATAL(" + reason + ")";
    }
}
