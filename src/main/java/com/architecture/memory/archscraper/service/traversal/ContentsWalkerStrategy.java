package com.architecture.memory.archscraper.service.traversal;

import com.architecture.memory.archscraper.dto.github.GitHubContentEntry;
import com.architecture.memory.archscraper.exception.ConfigurationException;
import com.architecture.memory.archscraper.exception.UpstreamResponseException;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.service.ScrapeContext;
import com.architecture.memory.archscraper.service.github.GitHubApiClient;
import com.architecture.memory.archscraper.service.github.GitHubApiResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Breadth-first walk over the contents API, one call per directory:
 * GET /repos/{owner}/{repo}/contents/{path}
 *
 * <p>Starts at the source's subdirectory. Directories are visited in FIFO order of the listings,
 * which GitHub returns sorted by name, so the traversal order is reproducible. With a stop count
 * the walk ends as soon as that many directories holding a template file have been listed, which
 * keeps an anonymous pass inside its hourly quota.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ContentsWalkerStrategy implements TreeTraversalStrategy {

    private static final TypeReference<List<GitHubContentEntry>> LISTING_TYPE = new TypeReference<>() {};

    private final GitHubApiClient client;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String ref;
    // 0 means unlimited
    private final int maxDepth;

    @Override
    public TraversalMode mode() {
        return TraversalMode.WALKER;
    }

    @Override
    public List<FileEntry> listFiles(SourceSpec spec, ScrapeContext context) {
        return listFiles(spec, context, entry -> false, 0);
    }

    @Override
    public List<FileEntry> listFiles(SourceSpec spec,
                                     ScrapeContext context,
                                     Predicate<FileEntry> templateFile,
                                     int stopAfter) {
        String root = spec.hasSubdir() ? spec.subdir() : "";
        log.info("Walking {} from '{}'", spec, root.isEmpty() ? "/" : root);

        List<FileEntry> entries = new ArrayList<>();
        Deque<Directory> queue = new ArrayDeque<>();
        queue.add(new Directory(root, 0));
        Set<String> templateDirectories = new HashSet<>();
        int directoriesVisited = 0;

        while (!queue.isEmpty()) {
            if (stopAfter > 0 && templateDirectories.size() >= stopAfter) {
                log.info("Found templates in {} directories of {}, leaving {} directories unvisited",
                        templateDirectories.size(), spec, queue.size());
                break;
            }
            Directory current = queue.poll();
            GitHubApiResponse response = client.fetch(contentsUrl(spec, current.path()), context);
            directoriesVisited++;

            if (response.isNotFound()) {
                if (current.depth() == 0) {
                    throw new ConfigurationException("Path '" + root + "' not found in " + spec.fullName());
                }
                log.warn("Directory {} disappeared while walking {}, skipping", current.path(), spec.fullName());
                continue;
            }

            for (GitHubContentEntry item : readListing(response, spec, current.path())) {
                if (item.getPath() == null) {
                    continue;
                }
                if (item.isDirectory()) {
                    entries.add(FileEntry.directory(item.getPath(), item.getUrl()));
                    if (maxDepth <= 0 || current.depth() + 1 <= maxDepth) {
                        queue.add(new Directory(item.getPath(), current.depth() + 1));
                    }
                } else if (item.isFile()) {
                    String rawRef = item.getUrl() != null ? item.getUrl() : item.getDownloadUrl();
                    FileEntry file = FileEntry.file(item.getPath(), rawRef);
                    entries.add(file);
                    if (spec.contains(file.path()) && templateFile.test(file)) {
                        templateDirectories.add(file.parentPath());
                    }
                }
            }
        }

        List<FileEntry> inScope = entries.stream()
                .filter(entry -> spec.contains(entry.path()))
                .toList();
        log.info("Walked {} directories of {}, {} entries in scope", directoriesVisited, spec, inScope.size());
        return inScope;
    }

    private List<GitHubContentEntry> readListing(GitHubApiResponse response, SourceSpec spec, String path) {
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node != null && node.isArray()) {
                return objectMapper.convertValue(node, LISTING_TYPE);
            }
            if (node != null && node.isObject()) {
                // The walked path is a single file
                return List.of(objectMapper.treeToValue(node, GitHubContentEntry.class));
            }
            return List.of();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new UpstreamResponseException(
                    "Unreadable contents listing for " + spec.fullName() + "/" + path, e);
        }
    }

    private String contentsUrl(SourceSpec spec, String path) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(apiBaseUrl);
        if (path.isEmpty()) {
            builder.path("/repos/{owner}/{repo}/contents");
        } else {
            builder.path("/repos/{owner}/{repo}/contents/{path}");
        }
        if (ref != null && !ref.isBlank() && !"HEAD".equals(ref)) {
            builder.queryParam("ref", ref);
        }
        return path.isEmpty()
                ? builder.buildAndExpand(spec.owner(), spec.repo()).encode().toUriString()
                : builder.buildAndExpand(spec.owner(), spec.repo(), path).encode().toUriString();
    }

    private record Directory(String path, int depth) {
    }
}
