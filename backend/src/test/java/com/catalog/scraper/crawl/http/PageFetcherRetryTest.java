package com.catalog.scraper.crawl.http;

import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.FetchResult;
import com.catalog.scraper.crawl.model.FetchStatus;
import com.catalog.scraper.crawl.pipeline.ShutdownSignal;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PageFetcherRetryTest {
    private static final String URL = "https://books.example/catalogue/page-1.html";

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffPolicy backoff = new BackoffPolicy(100, 1000, bound -> 0L);

    @Test
    void permanentNetworkFailureStopsAfterExactlyThreeAttempts() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        };

        FetchResult result = fetcher(transport).fetch(task());

        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.status()).isEqualTo(FetchStatus.NETWORK_ERROR);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.errorMessage()).isEqualTo("connection reset");
        assertThat(sleeps).containsExactly(Duration.ofMillis(50), Duration.ofMillis(100));
    }

    @Test
    void serverErrorThenSuccessReturnsOk() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> calls.incrementAndGet() == 1
            ? new TransportResponse(503, "busy", URI.create(url))
            : new TransportResponse(200, "<html></html>", URI.create(url));

        FetchResult result = fetcher(transport).fetch(task());

        assertThat(result.isOk()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.body()).isEqualTo("<html></html>");
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void notFoundIsTerminalWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> {
            calls.incrementAndGet();
            return new TransportResponse(404, "missing", URI.create(url));
        };

        FetchResult result = fetcher(transport).fetch(task());

        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.status()).isEqualTo(FetchStatus.HTTP_ERROR);
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.errorMessage()).isEqualTo("http_404");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void timeoutsAreRetriedAndReportedAsTimeout() {
        PageTransport transport = url -> {
            throw new HttpTimeoutException("request timed out");
        };

        FetchResult result = fetcher(transport).fetch(task());

        assertThat(result.status()).isEqualTo(FetchStatus.TIMEOUT);
        assertThat(result.attempts()).isEqualTo(3);
    }

    @Test
    void rateLimitIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> {
            calls.incrementAndGet();
            return new TransportResponse(429, "", URI.create(url));
        };

        FetchResult result = fetcher(transport).fetch(task());

        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.statusCode()).isEqualTo(429);
    }

    @Test
    void raisedShutdownPreventsAnyAttempt() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> {
            calls.incrementAndGet();
            return new TransportResponse(200, "ok", URI.create(url));
        };
        ShutdownSignal shutdown = new ShutdownSignal();
        shutdown.raise("stop");

        FetchResult result = fetcher(transport).fetch(task(), shutdown);

        assertThat(calls.get()).isZero();
        assertThat(result.status()).isEqualTo(FetchStatus.CANCELLED);
    }

    @Test
    void shutdownDuringBackoffReturnsLastFailure() {
        ShutdownSignal shutdown = new ShutdownSignal();
        PageTransport transport = url -> {
            throw new IOException("refused");
        };
        PageFetcher fetcher = new PageFetcher(transport, backoff, 3, clock, duration -> shutdown.raise("stop"));

        FetchResult result = fetcher.fetch(task(), shutdown);

        assertThat(result.status()).isEqualTo(FetchStatus.NETWORK_ERROR);
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void invalidUrlFailsWithoutAttempt() {
        AtomicInteger calls = new AtomicInteger();
        PageTransport transport = url -> {
            calls.incrementAndGet();
            return new TransportResponse(200, "ok", URI.create(url));
        };

        FetchResult result = fetcher(transport).fetch(CrawlTask.detail("mailto:someone@example.com", "Travel"));

        assertThat(calls.get()).isZero();
        assertThat(result.status()).isEqualTo(FetchStatus.NETWORK_ERROR);
        assertThat(result.errorMessage()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isZero();
    }

    private PageFetcher fetcher(PageTransport transport) {
        return new PageFetcher(transport, backoff, 3, clock, sleeps::add);
    }

    private static CrawlTask task() {
        return CrawlTask.listing(URL, 1, "Travel");
    }
}
