package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.ParsedTemplate;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.model.TemplateMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps a parsed template and its provenance to an {@link ArchitectureDocument}.
 * No network or storage access; the only input besides the arguments is the clock.
 */
@Component
public class ArchitectureNormalizer {

    private final ArchitectureIdGenerator idGenerator;
    private final Clock clock;
    private final String htmlBaseUrl;
    private final String ref;
    private final Set<String> genericFileNames;

    public ArchitectureNormalizer(
            ArchitectureIdGenerator idGenerator,
            Clock clock,
            @Value("${github.html.base-url:https://github.com}") String htmlBaseUrl,
            @Value("${github.ref:HEAD}") String ref,
            TemplateCandidateFilter candidateFilter) {
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.htmlBaseUrl = htmlBaseUrl;
        this.ref = ref;
        this.genericFileNames = new LinkedHashSet<>(candidateFilter.getTemplateFileNames());
    }

    public ArchitectureDocument normalize(SourceSpec spec, FileEntry candidate, ParsedTemplate template) {
        return normalize(spec, candidate, template, null);
    }

    public ArchitectureDocument normalize(SourceSpec spec,
                                          FileEntry candidate,
                                          ParsedTemplate template,
                                          TemplateMetadata metadata) {
        String name = deriveName(spec, candidate);
        Set<String> resourceTypes = collectResourceTypes(template.getResources());

        return ArchitectureDocument.builder()
                .id(idGenerator.generate(spec.owner(), spec.repo(), candidate.path()))
                .name(name)
                .displayName(metadata != null && metadata.getDisplayName() != null ? metadata.getDisplayName() : name)
                .description(metadata != null ? metadata.getDescription() : null)
                .sourceOwner(spec.owner())
                .sourceRepo(spec.repo())
                .sourcePath(candidate.path())
                .sourceUrl(sourceUrl(spec, candidate.path()))
                .templateFile(candidate.fileName())
                .resourceTypes(resourceTypes)
                .resourceCount(resourceTypes.size())
                .parameterNames(new ArrayList<>(template.getParameters().keySet()))
                .outputNames(new ArrayList<>(template.getOutputs().keySet()))
                .metadata(metadata != null ? storableMetadata(metadata.getRaw()) : new LinkedHashMap<>())
                .scrapedAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * File name without extension, or the parent folder for generic names such as azuredeploy.json.
     * A generic template at the repository root is named after the repository.
     */
    String deriveName(SourceSpec spec, FileEntry candidate) {
        String fileName = candidate.fileName();
        if (genericFileNames.contains(fileName.toLowerCase(Locale.ROOT))) {
            String parent = candidate.parentName();
            return parent.isEmpty() ? spec.repo() : parent;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Distinct top-level resource types. ARM types are case-insensitive, the first spelling wins.
     */
    private Set<String> collectResourceTypes(List<ParsedTemplate.Resource> resources) {
        Map<String, String> byLowerCase = new LinkedHashMap<>();
        for (ParsedTemplate.Resource resource : resources) {
            String type = resource.getType();
            if (type != null && !type.isBlank()) {
                byLowerCase.putIfAbsent(type.toLowerCase(Locale.ROOT), type);
            }
        }
        return new TreeSet<>(byLowerCase.values());
    }

    /**
     * Copy of the raw metadata without {@code $}-prefixed keys such as {@code $schema}, which
     * MongoDB servers before 5.0 reject as field names.
     */
    static Map<String, Object> storableMetadata(Map<String, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (raw == null) {
            return copy;
        }
        raw.forEach((key, value) -> {
            if (key != null && !key.startsWith("$")) {
                copy.put(key, storableValue(value));
            }
        });
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object storableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return storableMetadata((Map<String, ?>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(storableValue(element));
            }
            return copy;
        }
        return value;
    }

    private String sourceUrl(SourceSpec spec, String path) {
        return UriComponentsBuilder.fromHttpUrl(htmlBaseUrl)
                .path("/{owner}/{repo}/blob/{ref}/{path}")
                .buildAndExpand(spec.owner(), spec.repo(), ref, path)
                .encode()
                .toUriString();
    }
}
