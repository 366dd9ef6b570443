package com.architecture.memory.archscraper.exception;

/**
 * Transport-level failure that persisted after bounded retries.
 */
public class NetworkException extends ScraperException {

    public NetworkException(String message) {
        super(FailureCategory.NETWORK, message);
    }

    public NetworkException(String message, Throwable cause) {
        super(FailureCategory.NETWORK, message, cause);
    }
}
