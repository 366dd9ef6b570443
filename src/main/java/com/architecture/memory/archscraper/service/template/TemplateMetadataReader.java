package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.exception.FailureCategory;
import com.architecture.memory.archscraper.exception.ScraperException;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.TemplateMetadata;
import com.architecture.memory.archscraper.service.ScrapeContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the optional {@code metadata.json} that quickstart folders keep next to their template.
 * Metadata is best effort: any failure except cancellation and credential rejection yields empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateMetadataReader {

    public static final String METADATA_FILE = "metadata.json";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final TemplateContentFetcher contentFetcher;
    private final ObjectMapper objectMapper;

    public Optional<TemplateMetadata> readFor(FileEntry template, Map<String, FileEntry> filesByPath, ScrapeContext context) {
        String parent = template.parentPath();
        String metadataPath = parent.isEmpty() ? METADATA_FILE : parent + "/" + METADATA_FILE;
        FileEntry metadataEntry = filesByPath.get(metadataPath);
        if (metadataEntry == null || metadataEntry.isDirectory()) {
            return Optional.empty();
        }
        return read(metadataEntry, context);
    }

    public Optional<TemplateMetadata> read(FileEntry metadataEntry, ScrapeContext context) {
        try {
            String content = contentFetcher.fetch(metadataEntry, context);
            Map<String, Object> raw = objectMapper.readValue(content, MAP_TYPE);
            if (raw == null) {
                return Optional.empty();
            }

            return Optional.of(TemplateMetadata.builder()
                    .displayName(firstText(raw, "itemDisplayName", "title", "name"))
                    .description(firstText(raw, "description", "summary"))
                    .raw(raw)
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable {}: {}", metadataEntry.path(), e.getOriginalMessage());
            return Optional.empty();
        } catch (ScraperException e) {
            if (e.getCategory() == FailureCategory.CANCELLED || e.getCategory() == FailureCategory.AUTHENTICATION) {
                throw e;
            }
            log.warn("Could not read {}: {}", metadataEntry.path(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String firstText(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }
}
