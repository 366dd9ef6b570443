package com.architecture.memory.archscraper.exception;

/**
 * Non-retryable, unexpected HTTP status from the upstream API.
 */
public class UpstreamResponseException extends ScraperException {

    public UpstreamResponseException(String message) {
        super(FailureCategory.UPSTREAM, message);
    }

    public UpstreamResponseException(String message, Throwable cause) {
        super(FailureCategory.UPSTREAM, message, cause);
    }
}
