package com.architecture.memory.archscraper.controller;

import com.architecture.memory.archscraper.dto.ArchitectureListResponse;
import com.architecture.memory.archscraper.dto.ArchitectureQuery;
import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.service.ArchitectureQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/architectures")
@RequiredArgsConstructor
public class ArchitectureController {

    private final ArchitectureQueryService queryService;

    @GetMapping
    public ResponseEntity<ArchitectureListResponse> listArchitectures(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) Integer minResources,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String owner,
            @RequestParam(required = false) String repo,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "25") int size,
            @RequestParam(defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "asc") String sortDir) {

        ArchitectureQuery query = ArchitectureQuery.builder()
                .q(q)
                .minResources(minResources)
                .resourceType(resourceType)
                .owner(owner)
                .repo(repo)
                .page(page)
                .size(size)
                .sortBy(sortBy)
                .sortDir(sortDir)
                .build();
        return ResponseEntity.ok(queryService.search(query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ArchitectureDocument> getArchitecture(@PathVariable String id) {
        return ResponseEntity.ok(queryService.getById(id));
    }
}
