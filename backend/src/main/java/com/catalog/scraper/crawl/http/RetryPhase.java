package com.catalog.scraper.crawl.http;

public enum RetryPhase {
    ATTEMPTING,
    BACKOFF,
    EXHAUSTED,
    SUCCEEDED
}
