package com.architecture.memory.archscraper.service.template;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Stable identity for an architecture document.
 *
 * Format: sha256-hex("{owner}/{repo}/{path}"), owner and repo lower-cased because GitHub treats
 * them case-insensitively; the path keeps its case.
 */
@Component
public class ArchitectureIdGenerator {

    private static final String SHA_256 = "SHA-256";

    public String generate(String owner, String repo, String path) {
        if (owner == null || repo == null || path == null) {
            throw new IllegalArgumentException("owner, repo and path are required to derive an architecture id");
        }

        String key = owner.toLowerCase(Locale.ROOT) + "/" + repo.toLowerCase(Locale.ROOT) + "/" + path;
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_256);
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
