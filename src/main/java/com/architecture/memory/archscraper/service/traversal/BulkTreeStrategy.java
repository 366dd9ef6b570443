package com.architecture.memory.archscraper.service.traversal;

import com.architecture.memory.archscraper.dto.github.GitHubTreeResponse;
import com.architecture.memory.archscraper.exception.ConfigurationException;
import com.architecture.memory.archscraper.exception.UpstreamResponseException;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.service.ScrapeContext;
import com.architecture.memory.archscraper.service.github.GitHubApiClient;
import com.architecture.memory.archscraper.service.github.GitHubApiResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists a whole repository with a single recursive git-tree call:
 * GET /repos/{owner}/{repo}/git/trees/{ref}?recursive=1
 */
@Slf4j
@RequiredArgsConstructor
public class BulkTreeStrategy implements TreeTraversalStrategy {

    private final GitHubApiClient client;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String ref;

    @Override
    public TraversalMode mode() {
        return TraversalMode.BULK;
    }

    @Override
    public List<FileEntry> listFiles(SourceSpec spec, ScrapeContext context) {
        String url = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/repos/{owner}/{repo}/git/trees/{ref}")
                .queryParam("recursive", "1")
                .buildAndExpand(spec.owner(), spec.repo(), ref)
                .encode()
                .toUriString();

        log.info("Listing {} with recursive tree call (ref={})", spec, ref);
        GitHubApiResponse response = client.fetch(url, context);

        if (response.isNotFound()) {
            throw new ConfigurationException("Repository " + spec.fullName() + " or ref '" + ref + "' not found");
        }

        GitHubTreeResponse tree;
        try {
            tree = objectMapper.readValue(response.body(), GitHubTreeResponse.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamResponseException("Unreadable tree listing for " + spec.fullName(), e);
        }

        if (tree.isTruncated()) {
            log.warn("Tree listing for {} was truncated by GitHub; some files will not be scanned", spec.fullName());
        }

        List<FileEntry> entries = new ArrayList<>();
        for (GitHubTreeResponse.Entry item : tree.getTree()) {
            if (item.getPath() == null || !spec.contains(item.getPath())) {
                continue;
            }
            if ("blob".equals(item.getType())) {
                entries.add(FileEntry.file(item.getPath(), item.getUrl()));
            } else if ("tree".equals(item.getType())) {
                entries.add(FileEntry.directory(item.getPath(), item.getUrl()));
            }
            // "commit" entries are submodules and are not followed
        }

        log.info("Tree listing for {} returned {} entries in scope", spec, entries.size());
        return entries;
    }
}
