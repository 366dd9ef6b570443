package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.exception.TemplateParseException;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.service.ScrapeContext;
import com.architecture.memory.archscraper.service.github.GitHubApiClient;
import com.architecture.memory.archscraper.service.github.GitHubApiResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Retrieves the text of a listed file. Blob and contents API responses wrap the file in a
 * base64 envelope; any other body (raw download URLs) is returned as is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateContentFetcher {

    private final GitHubApiClient client;
    private final ObjectMapper objectMapper;

    public String fetch(FileEntry entry, ScrapeContext context) {
        if (entry.rawRef() == null || entry.rawRef().isBlank()) {
            throw new TemplateParseException("No content reference for " + entry.path());
        }

        GitHubApiResponse response = client.fetch(entry.rawRef(), context);
        if (response.isNotFound()) {
            throw new TemplateParseException("Content of " + entry.path() + " not found");
        }
        return decode(entry.path(), response.body());
    }

    String decode(String path, String body) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return body;
        }

        if (envelope == null || !envelope.isObject() || !envelope.has("encoding") || !envelope.has("content")) {
            return body;
        }

        String encoding = envelope.get("encoding").asText();
        if (!"base64".equalsIgnoreCase(encoding)) {
            // GitHub answers "none" for files above the contents API size limit
            throw new TemplateParseException("Unsupported content encoding '" + encoding + "' for " + path);
        }

        try {
            byte[] bytes = Base64.getMimeDecoder().decode(envelope.get("content").asText());
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException("Corrupt base64 content for " + path, e);
        }
    }
}
