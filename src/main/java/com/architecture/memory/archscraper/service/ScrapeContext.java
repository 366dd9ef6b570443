package com.architecture.memory.archscraper.service;

import com.architecture.memory.archscraper.exception.ScrapeCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline signal for one scrape pass. Every outbound call checks it first,
 * so a cancelled pass stops issuing requests and keeps what it already normalized.
 */
public class ScrapeContext {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private ScrapeContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static ScrapeContext unbounded() {
        return new ScrapeContext(Clock.systemUTC(), null);
    }

    /**
     * @param timeout pass timeout; null, zero or negative means no deadline
     */
    public static ScrapeContext withTimeout(Clock clock, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new ScrapeContext(clock, null);
        }
        return new ScrapeContext(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void ensureActive() {
        if (cancelled.get()) {
            throw new ScrapeCancelledException("Scrape pass was cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new ScrapeCancelledException("Scrape pass exceeded its deadline " + deadline);
        }
    }

    /**
     * Fails when a blocking wait of the given length would end after the deadline.
     */
    public void ensureCanWait(Duration wait) {
        ensureActive();
        if (deadline != null && clock.instant().plus(wait).isAfter(deadline)) {
            throw new ScrapeCancelledException(
                    String.format("Waiting %ds would run past the pass deadline %s", wait.toSeconds(), deadline));
        }
    }
}
