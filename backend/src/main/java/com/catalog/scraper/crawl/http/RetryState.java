package com.catalog.scraper.crawl.http;

import com.catalog.scraper.crawl.model.CrawlTask;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry bookkeeping for a single fetch invocation. Not shared between threads.
 */
public final class RetryState {
    private final CrawlTask task;
    private final int maxAttempts;
    private int attemptCount;
    private Instant nextEligibleAt;
    private RetryPhase phase = RetryPhase.ATTEMPTING;

    public RetryState(CrawlTask task, int maxAttempts) {
        this.task = task;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public void beginAttempt(Instant now) {
        attemptCount++;
        nextEligibleAt = now;
        phase = RetryPhase.ATTEMPTING;
    }

    public void scheduleBackoff(Instant now, Duration delay) {
        nextEligibleAt = now.plus(delay);
        phase = RetryPhase.BACKOFF;
    }

    public void markSucceeded() {
        phase = RetryPhase.SUCCEEDED;
    }

    /**
     * No further attempt will be made, either because the budget is spent or the failure is not
     * retryable.
     */
    public void markExhausted() {
        phase = RetryPhase.EXHAUSTED;
    }

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }

    public Duration remainingBackoff(Instant now) {
        if (phase != RetryPhase.BACKOFF || nextEligibleAt == null || !nextEligibleAt.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, nextEligibleAt);
    }

    public CrawlTask task() {
        return task;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public Instant nextEligibleAt() {
        return nextEligibleAt;
    }

    public RetryPhase phase() {
        return phase;
    }
}
