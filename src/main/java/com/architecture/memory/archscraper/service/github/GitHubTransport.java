package com.architecture.memory.archscraper.service.github;

import java.io.IOException;

/**
 * Single GET against the upstream API. Implementations return every HTTP status as a response
 * and report transport problems (timeouts, resets, refused connections) as {@link IOException}.
 */
@FunctionalInterface
public interface GitHubTransport {

    GitHubApiResponse get(String url) throws IOException;
}
