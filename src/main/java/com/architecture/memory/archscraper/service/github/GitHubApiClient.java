package com.architecture.memory.archscraper.service.github;

import com.architecture.memory.archscraper.exception.AuthenticationException;
import com.architecture.memory.archscraper.exception.NetworkException;
import com.architecture.memory.archscraper.exception.RateLimitExceededException;
import com.architecture.memory.archscraper.exception.ScrapeCancelledException;
import com.architecture.memory.archscraper.exception.UpstreamResponseException;
import com.architecture.memory.archscraper.service.ScrapeContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;

/**
 * Rate-limit guarded GET client for the GitHub REST API. Every traversal and fetch goes through
 * one instance of this class.
 *
 * <ul>
 *   <li>2xx and 404 are returned to the caller.</li>
 *   <li>Quota exhaustion waits for the reset and retries, up to {@code maxQuotaAttempts} requests,
 *       then fails with {@link RateLimitExceededException}.</li>
 *   <li>401 and non-quota 403 fail immediately with {@link AuthenticationException}.</li>
 *   <li>Transport errors and 5xx back off exponentially, up to {@code maxNetworkAttempts} requests,
 *       then fail with {@link NetworkException}.</li>
 *   <li>Any other status fails with {@link UpstreamResponseException}.</li>
 * </ul>
 */
@Slf4j
public class GitHubApiClient {

    private final GitHubTransport transport;
    private final RateLimitGuard guard;
    private final Sleeper sleeper;
    private final int maxQuotaAttempts;
    private final int maxNetworkAttempts;
    private final Duration networkBaseDelay;

    public GitHubApiClient(GitHubTransport transport,
                           RateLimitGuard guard,
                           Sleeper sleeper,
                           int maxQuotaAttempts,
                           int maxNetworkAttempts,
                           Duration networkBaseDelay) {
        this.transport = transport;
        this.guard = guard;
        this.sleeper = sleeper;
        this.maxQuotaAttempts = maxQuotaAttempts;
        this.maxNetworkAttempts = maxNetworkAttempts;
        this.networkBaseDelay = networkBaseDelay;
    }

    public GitHubApiResponse fetch(String url) {
        return fetch(url, ScrapeContext.unbounded());
    }

    public GitHubApiResponse fetch(String url, ScrapeContext context) {
        RetryBudget quotaBudget = new RetryBudget(maxQuotaAttempts, Duration.ZERO);
        RetryBudget networkBudget = new RetryBudget(maxNetworkAttempts, networkBaseDelay);

        try {
            while (true) {
                context.ensureActive();
                guard.awaitQuota(context);

                GitHubApiResponse response;
                try {
                    response = transport.get(url);
                } catch (IOException e) {
                    retryTransient(networkBudget, url, e.getMessage(), e, context);
                    continue;
                }

                guard.record(response);
                int status = response.status();

                if (response.isSuccessful() || response.isNotFound()) {
                    return response;
                }

                if (guard.isQuotaExhausted(response)) {
                    if (!quotaBudget.recordFailure()) {
                        throw new RateLimitExceededException(String.format(
                                "Rate limit still exhausted after %d attempts for %s",
                                quotaBudget.getFailedAttempts(), url));
                    }
                    guard.waitForReset(response, context);
                    continue;
                }

                if (status == 401 || status == 403) {
                    throw new AuthenticationException(String.format(
                            "GitHub API rejected credentials with %d for %s: %s", status, url, abbreviate(response.body())));
                }

                if (status >= 500) {
                    retryTransient(networkBudget, url, "HTTP " + status, null, context);
                    continue;
                }

                throw new UpstreamResponseException(String.format(
                        "GitHub API returned %d for %s: %s", status, url, abbreviate(response.body())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeCancelledException("Interrupted while waiting to call " + url);
        }
    }

    private void retryTransient(RetryBudget budget, String url, String reason, Throwable cause, ScrapeContext context)
            throws InterruptedException {
        if (!budget.recordFailure()) {
            String message = String.format("Giving up on %s after %d attempts: %s", url, budget.getFailedAttempts(), reason);
            throw cause != null ? new NetworkException(message, cause) : new NetworkException(message);
        }
        Duration delay = budget.backoffDelay();
        log.warn("Transient failure calling {} (attempt {}/{}): {}. Retrying in {}ms",
                url, budget.getFailedAttempts(), budget.getMaxAttempts(), reason, delay.toMillis());
        context.ensureCanWait(delay);
        sleeper.sleep(delay);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
