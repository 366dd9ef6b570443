package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.model.FileEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Narrows a repository listing to template candidates.
 *
 * <p>Known template filenames always win: within a directory only the highest-precedence exact
 * match (allow-list order) is kept. Matching any {@code *.json} is opt-in and only applies to
 * directories without an exact match.</p>
 */
@Component
@Slf4j
public class TemplateCandidateFilter {

    private static final Set<String> NEVER_TEMPLATES = Set.of(
            "metadata.json", "package.json", "package-lock.json", "tsconfig.json", "bicepconfig.json");

    private static final String PARAMETERS_SUFFIX = ".parameters.json";

    private final List<String> templateFileNames;
    private final boolean includeGenericJson;
    private final boolean onePerDirectory;

    public TemplateCandidateFilter(
            @Value("${scraper.candidates.filenames:azuredeploy.json,main.json,template.json}") List<String> templateFileNames,
            @Value("${scraper.candidates.include-generic-json:false}") boolean includeGenericJson,
            @Value("${scraper.candidates.one-per-directory:true}") boolean onePerDirectory) {
        this.templateFileNames = templateFileNames.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();
        this.includeGenericJson = includeGenericJson;
        this.onePerDirectory = onePerDirectory;
    }

    public List<FileEntry> filter(List<FileEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }

        // Lowest allow-list index seen per directory
        Map<String, Integer> bestRankByDirectory = new HashMap<>();
        for (FileEntry entry : entries) {
            int rank = exactRank(entry);
            if (rank >= 0) {
                bestRankByDirectory.merge(entry.parentPath(), rank, Math::min);
            }
        }

        List<FileEntry> candidates = new ArrayList<>();
        for (FileEntry entry : entries) {
            int rank = exactRank(entry);
            if (rank >= 0) {
                if (!onePerDirectory || rank == bestRankByDirectory.get(entry.parentPath())) {
                    candidates.add(entry);
                }
            } else if (isGenericCandidate(entry) && !bestRankByDirectory.containsKey(entry.parentPath())) {
                candidates.add(entry);
            }
        }

        log.debug("Candidate filter kept {} of {} entries", candidates.size(), entries.size());
        return candidates;
    }

    /**
     * Whether the entry could become a candidate by its own name, ignoring its siblings.
     */
    public boolean isTemplateFile(FileEntry entry) {
        return exactRank(entry) >= 0 || isGenericCandidate(entry);
    }

    /**
     * Filenames treated as generic: the template name carries no information about the architecture.
     */
    public List<String> getTemplateFileNames() {
        return templateFileNames;
    }

    private int exactRank(FileEntry entry) {
        if (entry.isDirectory()) {
            return -1;
        }
        return templateFileNames.indexOf(entry.fileName().toLowerCase(Locale.ROOT));
    }

    private boolean isGenericCandidate(FileEntry entry) {
        if (!includeGenericJson || entry.isDirectory()) {
            return false;
        }
        String name = entry.fileName().toLowerCase(Locale.ROOT);
        return name.endsWith(".json")
                && !name.startsWith(".")
                && !name.endsWith(PARAMETERS_SUFFIX)
                && !NEVER_TEMPLATES.contains(name);
    }
}
