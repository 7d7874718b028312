package com.catalog.scraper.crawl.http;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.FetchResult;
import com.catalog.scraper.crawl.model.FetchStatus;
import com.catalog.scraper.crawl.pipeline.ShutdownSignal;
import com.catalog.scraper.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;

/**
 * Fetches one task with retry. Network errors, timeouts and HTTP 408/429/5xx are retried with
 * exponential backoff up to {@code maxAttempts} total attempts; every other outcome is returned as is.
 * Never throws: the caller inspects {@link FetchResult#status()}.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PageTransport transport;
    private final BackoffPolicy backoffPolicy;
    private final int maxAttempts;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public PageFetcher(PageTransport transport, ScraperProperties properties, Clock clock, Sleeper sleeper) {
        this(
            transport,
            new BackoffPolicy(properties.getRetryBaseDelayMs(), properties.getRetryMaxDelayMs()),
            properties.getMaxAttempts(),
            clock,
            sleeper
        );
    }

    public PageFetcher(
        PageTransport transport,
        BackoffPolicy backoffPolicy,
        int maxAttempts,
        Clock clock,
        Sleeper sleeper
    ) {
        this.transport = transport;
        this.backoffPolicy = backoffPolicy;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public FetchResult fetch(CrawlTask task) {
        return fetch(task, ShutdownSignal.never());
    }

    public FetchResult fetch(CrawlTask task, ShutdownSignal shutdown) {
        if (UrlUtils.toHttpUri(task.url()) == null) {
            return FetchResult.failure(task, FetchStatus.NETWORK_ERROR, 0, clock.instant(), "invalid_url");
        }
        RetryState state = new RetryState(task, maxAttempts);
        FetchResult last = null;
        while (true) {
            if (shutdown.isRaised()) {
                state.markExhausted();
                return last != null
                    ? last
                    : FetchResult.failure(task, FetchStatus.CANCELLED, state.attemptCount(), clock.instant(), "shutdown");
            }
            state.beginAttempt(clock.instant());
            last = attemptOnce(task, state.attemptCount());
            if (last.isOk()) {
                state.markSucceeded();
                return last;
            }
            if (last.status() == FetchStatus.CANCELLED || !isRetryable(last)) {
                state.markExhausted();
                return last;
            }
            if (!state.hasAttemptsLeft()) {
                state.markExhausted();
                log.warn(
                    "Giving up on {} after {} attempts: {}",
                    task.url(),
                    state.attemptCount(),
                    describe(last)
                );
                return last;
            }
            Duration delay = backoffPolicy.delayFor(state.attemptCount());
            state.scheduleBackoff(clock.instant(), delay);
            log.debug("Attempt {} for {} failed ({}), retrying in {} ms",
                state.attemptCount(), task.url(), describe(last), delay.toMillis());
            if (!awaitEligible(state)) {
                state.markExhausted();
                return last;
            }
        }
    }

    static boolean isRetryable(FetchResult result) {
        return switch (result.status()) {
            case NETWORK_ERROR, TIMEOUT -> true;
            case HTTP_ERROR -> {
                int status = result.statusCode();
                yield status == 408 || status == 429 || status >= 500;
            }
            default -> false;
        };
    }

    private FetchResult attemptOnce(CrawlTask task, int attempt) {
        try {
            TransportResponse response = transport.load(task.url());
            if (response.isSuccessful()) {
                return FetchResult.ok(task, response.statusCode(), response.body(), attempt, clock.instant());
            }
            return FetchResult.httpError(task, response.statusCode(), attempt, clock.instant());
        } catch (HttpTimeoutException | SocketTimeoutException e) {
            return FetchResult.failure(task, FetchStatus.TIMEOUT, attempt, clock.instant(), e.getMessage());
        } catch (IOException e) {
            return FetchResult.failure(task, FetchStatus.NETWORK_ERROR, attempt, clock.instant(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(task, FetchStatus.CANCELLED, attempt, clock.instant(), "interrupted");
        } catch (RuntimeException e) {
            return FetchResult.failure(
                task,
                FetchStatus.NETWORK_ERROR,
                attempt,
                clock.instant(),
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }

    private boolean awaitEligible(RetryState state) {
        Duration wait = state.remainingBackoff(clock.instant());
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(FetchResult result) {
        if (result.status() == FetchStatus.HTTP_ERROR) {
            return "HTTP " + result.statusCode();
        }
        return result.status() + (result.errorMessage() == null ? "" : " " + result.errorMessage());
    }
}
