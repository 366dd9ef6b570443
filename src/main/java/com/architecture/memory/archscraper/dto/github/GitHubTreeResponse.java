package com.architecture.memory.archscraper.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of GET /repos/{owner}/{repo}/git/trees/{ref}?recursive=1
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubTreeResponse {

    private String sha;

    private String url;

    private boolean truncated;

    @Builder.Default
    private List<Entry> tree = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String path;
        private String mode;
        // "blob", "tree" or "commit" (submodule)
        private String type;
        private String sha;
        private Long size;
        private String url;
    }
}
