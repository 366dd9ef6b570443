package com.architecture.memory.archscraper.exception;

/**
 * Upsert into the document store failed.
 */
public class StorageException extends ScraperException {

    public StorageException(String message) {
        super(FailureCategory.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(FailureCategory.STORAGE, message, cause);
    }
}
