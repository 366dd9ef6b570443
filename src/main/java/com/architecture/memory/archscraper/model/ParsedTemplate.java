package com.architecture.memory.archscraper.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of an ARM template. Sections absent from the source document are empty, never null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedTemplate {

    @Builder.Default
    private List<Resource> resources = new ArrayList<>();

    // Insertion order of the source document is preserved
    @Builder.Default
    private Map<String, Parameter> parameters = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Output> outputs = new LinkedHashMap<>();

    private String schema;

    private String contentVersion;

    public boolean isEmpty() {
        return resources.isEmpty() && parameters.isEmpty() && outputs.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Resource {
        private String type;
        private String name;
        private String apiVersion;

        @Builder.Default
        private List<String> dependsOn = new ArrayList<>();

        @Builder.Default
        private List<Resource> children = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameter {
        private String type;
        private JsonNode defaultValue;

        public Optional<JsonNode> defaultValue() {
            return Optional.ofNullable(defaultValue);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Output {
        private String type;
    }
}
