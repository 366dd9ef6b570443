package com.architecture.memory.archscraper.service.source;

import com.architecture.memory.archscraper.exception.ConfigurationException;
import com.architecture.memory.archscraper.model.SourceSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code Owner/Repo[:subdir]} source strings into {@link SourceSpec}s.
 */
@Service
@Slf4j
public class SourceSpecResolver {

    // GitHub owner and repository names: letters, digits, '.', '_' and '-'
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    public SourceSpec resolve(String source) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("Source specification is empty");
        }

        String trimmed = source.trim();
        String repoPart = trimmed;
        String subdir = null;

        int colon = trimmed.indexOf(':');
        if (colon >= 0) {
            repoPart = trimmed.substring(0, colon).trim();
            subdir = normalizeSubdir(trimmed.substring(colon + 1));
        }

        int slash = repoPart.indexOf('/');
        if (slash <= 0 || slash == repoPart.length() - 1) {
            throw new ConfigurationException("Source '" + source + "' must have the form Owner/Repo[:subdir]");
        }

        String owner = repoPart.substring(0, slash);
        String repo = repoPart.substring(slash + 1);

        if (!NAME_PATTERN.matcher(owner).matches()) {
            throw new ConfigurationException("Invalid owner '" + owner + "' in source '" + source + "'");
        }
        if (!NAME_PATTERN.matcher(repo).matches() || ".".equals(repo) || "..".equals(repo)) {
            throw new ConfigurationException("Invalid repository '" + repo + "' in source '" + source + "'");
        }

        return new SourceSpec(owner, repo, subdir);
    }

    /**
     * Resolves every source independently; malformed strings are reported without affecting the others.
     */
    public Resolution resolveAll(List<String> sources) {
        List<SourceSpec> specs = new ArrayList<>();
        Map<String, ConfigurationException> failures = new LinkedHashMap<>();

        if (sources != null) {
            for (String source : sources) {
                try {
                    specs.add(resolve(source));
                } catch (ConfigurationException e) {
                    log.warn("Ignoring source '{}': {}", source, e.getMessage());
                    failures.put(source, e);
                }
            }
        }
        return new Resolution(specs, failures);
    }

    private String normalizeSubdir(String raw) {
        String subdir = raw.trim();
        while (subdir.startsWith("/")) {
            subdir = subdir.substring(1);
        }
        while (subdir.endsWith("/")) {
            subdir = subdir.substring(0, subdir.length() - 1);
        }
        return subdir.isEmpty() ? null : subdir;
    }

    public record Resolution(List<SourceSpec> specs, Map<String, ConfigurationException> failures) {
    }
}
