package com.architecture.memory.archscraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalized description of the architecture defined by one template file.
 * The id is derived from owner, repository and path, so a re-scrape replaces the stored document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "architectures")
@CompoundIndex(name = "source_idx", def = "{'sourceOwner': 1, 'sourceRepo': 1, 'sourcePath': 1}")
public class ArchitectureDocument {

    @Id
    private String id;

    @Indexed
    private String name;

    private String displayName;

    private String description;

    private String sourceOwner;

    private String sourceRepo;

    private String sourcePath;

    private String sourceUrl;

    private String templateFile;

    @Builder.Default
    private Set<String> resourceTypes = new TreeSet<>();

    @Indexed
    private int resourceCount;

    @Builder.Default
    private List<String> parameterNames = new ArrayList<>();

    @Builder.Default
    private List<String> outputNames = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private LocalDateTime createdAt;

    private LocalDateTime scrapedAt;
}
