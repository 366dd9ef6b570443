package com.architecture.memory.archscraper.service.github;

import lombok.Getter;

import java.time.Duration;

/**
 * Bounded retry state for one request: counts failed attempts and yields the exponential
 * backoff for the next one. Once {@link #isExhausted()} the request must fail.
 */
@Getter
public class RetryBudget {

    private static final int MAX_SHIFT = 16;

    private final int maxAttempts;
    private final Duration baseDelay;
    private int failedAttempts;

    public RetryBudget(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
    }

    /**
     * Records a failed attempt.
     *
     * @return true when another attempt is allowed
     */
    public boolean recordFailure() {
        failedAttempts++;
        return !isExhausted();
    }

    public boolean isExhausted() {
        return failedAttempts >= maxAttempts;
    }

    /**
     * Delay before the next attempt: base, 2x base, 4x base, ... for the 1st, 2nd, 3rd failure.
     */
    public Duration backoffDelay() {
        if (failedAttempts == 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(failedAttempts - 1, MAX_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }
}
