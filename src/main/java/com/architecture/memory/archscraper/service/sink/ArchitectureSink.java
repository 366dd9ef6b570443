package com.architecture.memory.archscraper.service.sink;

import com.architecture.memory.archscraper.exception.StorageException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;

/**
 * Destination for normalized documents. Upserts are keyed by {@link ArchitectureDocument#getId()}:
 * writing the same id again replaces the stored document.
 */
public interface ArchitectureSink {

    void upsert(ArchitectureDocument document) throws StorageException;
}
