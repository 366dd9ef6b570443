package com.architecture.memory.archscraper.exception;

/**
 * The upstream quota stayed exhausted for every allowed attempt.
 */
public class RateLimitExceededException extends ScraperException {

    public RateLimitExceededException(String message) {
        super(FailureCategory.RATE_LIMIT, message);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(FailureCategory.RATE_LIMIT, message, cause);
    }
}
