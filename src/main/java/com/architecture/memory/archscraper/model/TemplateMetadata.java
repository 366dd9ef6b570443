package com.architecture.memory.archscraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive fields read from a {@code metadata.json} that sits next to a template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateMetadata {

    private String displayName;

    private String description;

    @Builder.Default
    private Map<String, Object> raw = new LinkedHashMap<>();
}
