package com.storyloop.core.retry;

import java.time.Duration;

/**
 * Retry ceiling and exponential backoff parameters.
 *
 * @param maxRetries  attempts at or above this number are never retried
 * @param baseBackoff delay before the first retry
 * @param multiplier  growth factor per attempt
 */
public record RetryPolicy(int maxRetries, Duration baseBackoff, double multiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(60), 2.0);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /** {@code baseBackoff * multiplier^attempt}, truncated to milliseconds. */
    public Duration backoff(int attempt) {
        double millis = baseBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        return Duration.ofMillis((long) millis);
    }
}
