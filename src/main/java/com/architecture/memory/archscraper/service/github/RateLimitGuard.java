package com.architecture.memory.archscraper.service.github;

import com.architecture.memory.archscraper.service.ScrapeContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide view of the upstream quota, shared by every component that calls the API.
 *
 * <p>The guard remembers the last {@code x-ratelimit-remaining}/{@code x-ratelimit-reset} pair it
 * saw. While the quota is known to be spent, callers block in {@link #awaitQuota(ScrapeContext)}
 * until the reset time. Waits happen under a single lock, so concurrent sources queue behind one
 * timer instead of each hammering the API.</p>
 */
@Slf4j
public class RateLimitGuard {

    public static final String REMAINING_HEADER = "x-ratelimit-remaining";
    public static final String RESET_HEADER = "x-ratelimit-reset";
    public static final String RETRY_AFTER_HEADER = "retry-after";

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration minimumWait;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private Long remaining;
    private Instant resetAt;

    public RateLimitGuard(Clock clock, Sleeper sleeper, Duration minimumWait) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.minimumWait = minimumWait != null && !minimumWait.isNegative() ? minimumWait : Duration.ZERO;
    }

    /**
     * Blocks while the last observed quota is exhausted and its reset lies in the future.
     */
    public void awaitQuota(ScrapeContext context) throws InterruptedException {
        lock.lock();
        try {
            if (remaining == null || remaining > 0 || resetAt == null) {
                return;
            }
            Instant now = clock.instant();
            if (!now.isBefore(resetAt)) {
                remaining = null;
                return;
            }
            Duration wait = floor(Duration.between(now, resetAt));
            context.ensureCanWait(wait);
            log.warn("[rate-limit] Quota exhausted, pausing {}s until reset at {}", wait.toSeconds(), resetAt);
            sleeper.sleep(wait);
            remaining = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Updates the shared quota view from response headers.
     */
    public void record(GitHubApiResponse response) {
        lock.lock();
        try {
            response.longHeader(REMAINING_HEADER).ifPresent(value -> remaining = value);
            response.longHeader(RESET_HEADER).ifPresent(epochSeconds -> resetAt = Instant.ofEpochSecond(epochSeconds));
        } finally {
            lock.unlock();
        }
    }

    /**
     * A 429, or a 403 that carries a quota signal. A bare 403 is a credential problem.
     */
    public boolean isQuotaExhausted(GitHubApiResponse response) {
        int status = response.status();
        if (status == 429) {
            return true;
        }
        if (status != 403) {
            return false;
        }
        if (response.longHeader(REMAINING_HEADER).map(value -> value <= 0).orElse(false)) {
            return true;
        }
        if (response.header(RETRY_AFTER_HEADER).isPresent()) {
            return true;
        }
        return response.body().toLowerCase(Locale.ROOT).contains("rate limit");
    }

    /**
     * Wait before retrying a quota-exhausted response: {@code retry-after} seconds when present,
     * otherwise the time left until {@code x-ratelimit-reset}. Never below the minimum wait.
     */
    public Duration computeWait(GitHubApiResponse response) {
        Duration wait = response.longHeader(RETRY_AFTER_HEADER)
                .map(Duration::ofSeconds)
                .or(() -> response.longHeader(RESET_HEADER)
                        .map(epochSeconds -> Duration.between(clock.instant(), Instant.ofEpochSecond(epochSeconds))))
                .orElse(Duration.ZERO);
        return floor(wait);
    }

    /**
     * Blocks for the wait computed from a quota-exhausted response. Other callers queue on the lock meanwhile.
     */
    public void waitForReset(GitHubApiResponse response, ScrapeContext context) throws InterruptedException {
        lock.lock();
        try {
            Duration wait = computeWait(response);
            context.ensureCanWait(wait);
            log.warn("[rate-limit] GitHub returned {}; waiting {}s before retrying", response.status(), wait.toSeconds());
            sleeper.sleep(wait);
            remaining = null;
        } finally {
            lock.unlock();
        }
    }

    private Duration floor(Duration wait) {
        if (wait.isNegative() || wait.compareTo(minimumWait) < 0) {
            return minimumWait;
        }
        return wait;
    }
}
