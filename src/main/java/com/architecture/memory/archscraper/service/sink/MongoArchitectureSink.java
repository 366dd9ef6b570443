package com.architecture.memory.archscraper.service.sink;

import com.architecture.memory.archscraper.exception.StorageException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.repository.ArchitectureDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Upserts into the {@code architectures} collection. The whole document is replaced on every
 * scrape; only {@code createdAt} survives from the previous version.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoArchitectureSink implements ArchitectureSink {

    private final ArchitectureDocumentRepository repository;

    @Override
    public void upsert(ArchitectureDocument document) {
        if (document == null || document.getId() == null) {
            throw new StorageException("Cannot upsert an architecture document without id");
        }

        try {
            repository.findById(document.getId())
                    .map(ArchitectureDocument::getCreatedAt)
                    .ifPresentOrElse(
                            document::setCreatedAt,
                            () -> document.setCreatedAt(document.getScrapedAt()));

            repository.save(document);
            log.debug("Upserted architecture {} ({})", document.getId(), document.getSourcePath());
        } catch (DataAccessException e) {
            throw new StorageException(
                    "Failed to upsert architecture " + document.getId() + " for " + document.getSourcePath() + ": " + e.getMessage(), e);
        }
    }
}
