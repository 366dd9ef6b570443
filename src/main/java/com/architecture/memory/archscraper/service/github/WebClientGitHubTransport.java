package com.architecture.memory.archscraper.service.github;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link GitHubTransport} on top of Spring's {@link WebClient}. Non-2xx statuses are returned,
 * not thrown, so the guarded client can inspect quota headers.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientGitHubTransport implements GitHubTransport {

    private final WebClient webClient;
    private final Duration requestTimeout;

    @Override
    public GitHubApiResponse get(String url) throws IOException {
        log.debug("GET {}", url);
        GitHubApiResponse response;
        try {
            response = webClient.get()
                    .uri(URI.create(url))
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new GitHubApiResponse(
                                    clientResponse.statusCode().value(),
                                    clientResponse.headers().asHttpHeaders(),
                                    body)))
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientRequestException e) {
            throw new IOException("Request to " + url + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new IOException("Request to " + url + " timed out after " + requestTimeout, cause);
            }
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw e;
        }

        if (response == null) {
            throw new IOException("No response received from " + url);
        }
        return response;
    }
}
