package com.architecture.memory.archscraper.exception;

/**
 * The upstream API rejected the configured credential (401, or 403 without a quota signal).
 */
public class AuthenticationException extends ScraperException {

    public AuthenticationException(String message) {
        super(FailureCategory.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(FailureCategory.AUTHENTICATION, message, cause);
    }
}
