package com.architecture.memory.archscraper.config;

import com.architecture.memory.archscraper.service.github.GitHubApiClient;
import com.architecture.memory.archscraper.service.github.GitHubTransport;
import com.architecture.memory.archscraper.service.github.RateLimitGuard;
import com.architecture.memory.archscraper.service.github.Sleeper;
import com.architecture.memory.archscraper.service.github.WebClientGitHubTransport;
import com.architecture.memory.archscraper.service.traversal.BulkTreeStrategy;
import com.architecture.memory.archscraper.service.traversal.ContentsWalkerStrategy;
import com.architecture.memory.archscraper.service.traversal.TraversalStrategySelector;
import com.architecture.memory.archscraper.service.traversal.TreeTraversalStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the GitHub access layer: one WebClient, one shared rate-limit guard, one API client,
 * and the traversal strategy picked from the credential and the force-walker switch.
 */
@Configuration
@Slf4j
public class GitHubClientConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Value("${github.api.base-url:https://api.github.com}")
    private String apiBaseUrl;

    @Value("${github.token:}")
    private String token;

    @Value("${github.ref:HEAD}")
    private String ref;

    @Value("${github.request-timeout:30s}")
    private Duration requestTimeout;

    @Value("${github.rate-limit.max-attempts:3}")
    private int maxQuotaAttempts;

    @Value("${github.rate-limit.min-wait:1s}")
    private Duration minimumQuotaWait;

    @Value("${github.retry.max-attempts:3}")
    private int maxNetworkAttempts;

    @Value("${github.retry.base-delay:500ms}")
    private Duration networkBaseDelay;

    @Value("${scraper.force-walker:false}")
    private boolean forceWalker;

    @Value("${scraper.walker.max-depth:0}")
    private int walkerMaxDepth;

    @Bean
    public WebClient gitHubWebClient(WebClient.Builder webClientBuilder) {
        // git blob and contents URLs may redirect to raw storage
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(requestTimeout);

        WebClient.Builder builder = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .defaultHeader(HttpHeaders.USER_AGENT, "arch-scraper");

        if (hasToken()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token.trim());
        }
        return builder.build();
    }

    @Bean
    public GitHubTransport gitHubTransport(WebClient gitHubWebClient) {
        return new WebClientGitHubTransport(gitHubWebClient, requestTimeout);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public RateLimitGuard rateLimitGuard(Clock clock, Sleeper sleeper) {
        return new RateLimitGuard(clock, sleeper, minimumQuotaWait);
    }

    @Bean
    public GitHubApiClient gitHubApiClient(GitHubTransport gitHubTransport, RateLimitGuard rateLimitGuard, Sleeper sleeper) {
        return new GitHubApiClient(gitHubTransport, rateLimitGuard, sleeper,
                maxQuotaAttempts, maxNetworkAttempts, networkBaseDelay);
    }

    @Bean
    public TreeTraversalStrategy treeTraversalStrategy(GitHubApiClient gitHubApiClient, ObjectMapper objectMapper) {
        TreeTraversalStrategy strategy = TraversalStrategySelector.choose(
                hasToken(),
                forceWalker,
                new BulkTreeStrategy(gitHubApiClient, objectMapper, apiBaseUrl, ref),
                new ContentsWalkerStrategy(gitHubApiClient, objectMapper, apiBaseUrl, ref, walkerMaxDepth));

        log.info("GitHub traversal strategy: {} (token configured: {}, force walker: {})",
                strategy.mode(), hasToken(), forceWalker);
        return strategy;
    }

    private boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
