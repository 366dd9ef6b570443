package com.architecture.memory.archscraper.exception;

/**
 * Raised when a scrape pass was cancelled or ran past its deadline before an HTTP call.
 */
public class ScrapeCancelledException extends ScraperException {

    public ScrapeCancelledException(String message) {
        super(FailureCategory.CANCELLED, message);
    }
}
