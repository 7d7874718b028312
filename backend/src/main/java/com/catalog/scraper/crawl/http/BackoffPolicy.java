package com.catalog.scraper.crawl.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff with jitter. The nominal delay for attempt {@code n} is
 * {@code base * 2^(n-1)}, capped at {@code max}; the returned delay falls in {@code [delay/2, delay)}.
 */
public final class BackoffPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final LongUnaryOperator jitter;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    /**
     * @param jitter maps an exclusive upper bound to a value in {@code [0, bound)}
     */
    public BackoffPolicy(long baseDelayMs, long maxDelayMs, LongUnaryOperator jitter) {
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.jitter = jitter;
    }

    public static BackoffPolicy none() {
        return new BackoffPolicy(0, 0);
    }

    public Duration delayFor(int attempt) {
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = baseDelayMs * (1L << shift);
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 1) {
            return Duration.ofMillis(delay);
        }
        long half = delay / 2;
        long spread = Math.max(1L, delay - half);
        return Duration.ofMillis(half + jitter.applyAsLong(spread));
    }
}
