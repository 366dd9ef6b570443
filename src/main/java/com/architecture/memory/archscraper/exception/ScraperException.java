package com.architecture.memory.archscraper.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the scrape pipeline.
 */
@Getter
public class ScraperException extends RuntimeException {

    private final FailureCategory category;

    public ScraperException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ScraperException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
