package com.architecture.memory.archscraper.service;

import com.architecture.memory.archscraper.dto.ArchitectureListResponse;
import com.architecture.memory.archscraper.dto.ArchitectureQuery;
import com.architecture.memory.archscraper.exception.ArchitectureNotFoundException;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.repository.ArchitectureDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read side over the stored architecture documents.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchitectureQueryService {

    static final int MAX_PAGE_SIZE = 200;
    private static final Set<String> SORTABLE_FIELDS = Set.of("name", "resourceCount");

    private final MongoTemplate mongoTemplate;
    private final ArchitectureDocumentRepository repository;

    public ArchitectureDocument getById(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new ArchitectureNotFoundException("Architecture not found with id: " + id));
    }

    public ArchitectureListResponse search(ArchitectureQuery request) {
        ArchitectureQuery filters = request != null ? request : new ArchitectureQuery();
        int page = Math.max(0, filters.getPage());
        int size = Math.min(Math.max(1, filters.getSize()), MAX_PAGE_SIZE);

        Query query = buildQuery(filters);
        long total = mongoTemplate.count(query, ArchitectureDocument.class);

        query.with(buildSort(filters))
                .skip((long) page * size)
                .limit(size);
        List<ArchitectureDocument> items = mongoTemplate.find(query, ArchitectureDocument.class);

        log.debug("Architecture search {} matched {} documents", filters, total);
        return ArchitectureListResponse.builder()
                .items(items)
                .page(page)
                .size(size)
                .total(total)
                .build();
    }

    Query buildQuery(ArchitectureQuery filters) {
        List<Criteria> criteria = new ArrayList<>();

        if (hasText(filters.getQ())) {
            criteria.add(Criteria.where("name").regex(Pattern.quote(filters.getQ().trim()), "i"));
        }
        if (filters.getMinResources() != null) {
            criteria.add(Criteria.where("resourceCount").gte(filters.getMinResources()));
        }
        if (hasText(filters.getResourceType())) {
            // resource types keep their original spelling, so match case-insensitively
            criteria.add(Criteria.where("resourceTypes")
                    .regex("^" + Pattern.quote(filters.getResourceType().trim()) + "$", "i"));
        }
        if (hasText(filters.getOwner())) {
            criteria.add(Criteria.where("sourceOwner")
                    .regex("^" + Pattern.quote(filters.getOwner().trim()) + "$", "i"));
        }
        if (hasText(filters.getRepo())) {
            criteria.add(Criteria.where("sourceRepo")
                    .regex("^" + Pattern.quote(filters.getRepo().trim()) + "$", "i"));
        }

        Query query = new Query();
        if (!criteria.isEmpty()) {
            query.addCriteria(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        }
        return query;
    }

    Sort buildSort(ArchitectureQuery filters) {
        String field = filters.getSortBy() != null && SORTABLE_FIELDS.contains(filters.getSortBy())
                ? filters.getSortBy()
                : "name";
        Sort.Direction direction = "desc".equalsIgnoreCase(filters.getSortDir())
                ? Sort.Direction.DESC
                : Sort.Direction.ASC;
        // id as tie breaker keeps paging stable
        return Sort.by(direction, field).and(Sort.by(Sort.Direction.ASC, "id"));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
