package com.catalog.scraper.crawl.model;

import java.time.Instant;

public record FetchResult(
    CrawlTask task,
    FetchStatus status,
    int statusCode,
    String body,
    int attempts,
    Instant fetchedAt,
    String errorMessage
) {
    public static FetchResult ok(CrawlTask task, int statusCode, String body, int attempts, Instant fetchedAt) {
        return new FetchResult(task, FetchStatus.OK, statusCode, body, attempts, fetchedAt, null);
    }

    public static FetchResult httpError(CrawlTask task, int statusCode, int attempts, Instant fetchedAt) {
        return new FetchResult(task, FetchStatus.HTTP_ERROR, statusCode, null, attempts, fetchedAt, "http_" + statusCode);
    }

    public static FetchResult failure(CrawlTask task, FetchStatus status, int attempts, Instant fetchedAt, String message) {
        return new FetchResult(task, status, 0, null, attempts, fetchedAt, message);
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
