package com.architecture.memory.archscraper.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Item of GET /repos/{owner}/{repo}/contents/{path}. For a file path the API returns a single
 * item with base64 {@code content}; for a directory it returns an array without content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubContentEntry {

    private String name;

    private String path;

    private String sha;

    // "file", "dir", "symlink" or "submodule"
    private String type;

    private Long size;

    private String url;

    @JsonProperty("download_url")
    private String downloadUrl;

    private String encoding;

    private String content;

    public boolean isDirectory() {
        return "dir".equals(type);
    }

    public boolean isFile() {
        return "file".equals(type);
    }
}
