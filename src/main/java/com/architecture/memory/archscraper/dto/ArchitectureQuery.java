package com.architecture.memory.archscraper.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters for listing stored architecture documents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchitectureQuery {

    private String q;
    private Integer minResources;
    private String resourceType;
    private String owner;
    private String repo;

    @Builder.Default
    private int page = 0;

    @Builder.Default
    private int size = 25;

    @Builder.Default
    private String sortBy = "name";

    @Builder.Default
    private String sortDir = "asc";
}
