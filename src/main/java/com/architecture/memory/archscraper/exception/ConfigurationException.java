package com.architecture.memory.archscraper.exception;

/**
 * A source specification or repository coordinate that cannot be used.
 */
public class ConfigurationException extends ScraperException {

    public ConfigurationException(String message) {
        super(FailureCategory.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureCategory.CONFIGURATION, message, cause);
    }
}
