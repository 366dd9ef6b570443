package com.architecture.memory.archscraper.service.github;

import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * Status, headers and body of one upstream call.
 */
public record GitHubApiResponse(int status, HttpHeaders headers, String body) {

    public GitHubApiResponse {
        headers = headers != null ? headers : new HttpHeaders();
        body = body != null ? body : "";
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.getFirst(name)).map(String::trim).filter(v -> !v.isEmpty());
    }

    public Optional<Long> longHeader(String name) {
        return header(name).flatMap(value -> {
            try {
                return Optional.of(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
