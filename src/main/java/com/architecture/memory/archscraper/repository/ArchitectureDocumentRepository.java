package com.architecture.memory.archscraper.repository;

import com.architecture.memory.archscraper.model.ArchitectureDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Lookup by id for the sink and the detail endpoint. Filtered listing goes through
 * {@code MongoTemplate} in {@code ArchitectureQueryService}.
 */
@Repository
public interface ArchitectureDocumentRepository extends MongoRepository<ArchitectureDocument, String> {
}
