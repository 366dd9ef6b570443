package com.architecture.memory.archscraper.exception;

/**
 * Classification of a failure recorded in a scrape summary.
 */
public enum FailureCategory {
    CONFIGURATION,
    AUTHENTICATION,
    RATE_LIMIT,
    NETWORK,
    UPSTREAM,
    PARSE,
    STORAGE,
    CANCELLED,
    UNEXPECTED
}
