package com.catalog.scraper.crawl.http;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.util.UrlUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Plain HTTP page loads with a global concurrency cap, a per-host concurrency cap and a minimum delay
 * between requests to the same host. A 403 or 429 pushes the host's next slot further out.
 */
@Service
public class PoliteHttpTransport implements PageTransport {
    private final ScraperProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpTransport(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getWorkerCount());
    }

    @Override
    public TransportResponse load(String url) throws IOException, InterruptedException {
        URI uri = UrlUtils.toHttpUri(url);
        if (uri == null) {
            throw new IOException("invalid_url: " + url);
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        Semaphore hostLimiter = hostLimiters.computeIfAbsent(
            host,
            ignored -> new Semaphore(properties.getPerHostConcurrency())
        );

        globalLimiter.acquire();
        try {
            hostLimiter.acquire();
            try {
                enforcePerHostDelay(host);
                HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                    .header("User-Agent", properties.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.8")
                    .GET()
                    .build();
                HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
                if (response.statusCode() == 403 || response.statusCode() == 429) {
                    extendBackoff(host, Duration.ofMillis(properties.getThrottledBackoffMs()));
                }
                byte[] bytes = response.body();
                String body = bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
                return new TransportResponse(response.statusCode(), body, response.uri());
            } finally {
                hostLimiter.release();
            }
        } finally {
            globalLimiter.release();
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }
}
