package com.storyloop.core.retry;

import java.time.Duration;

/**
 * Outcome of a retry query.
 *
 * @param backoff           delay to wait before the next attempt; zero when denied
 * @param attemptsRemaining retries left after this one
 */
public record RetryDecision(boolean shouldRetry, String reason, Duration backoff, int attemptsRemaining) {

    static RetryDecision deny(String reason, int attemptsRemaining) {
        return new RetryDecision(false, reason, Duration.ZERO, attemptsRemaining);
    }
}
