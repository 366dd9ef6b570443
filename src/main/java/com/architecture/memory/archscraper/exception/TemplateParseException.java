package com.architecture.memory.archscraper.exception;

/**
 * A template that could not be fetched or read as a usable document.
 */
public class TemplateParseException extends ScraperException {

    public TemplateParseException(String message) {
        super(FailureCategory.PARSE, message);
    }

    public TemplateParseException(String message, Throwable cause) {
        super(FailureCategory.PARSE, message, cause);
    }
}
