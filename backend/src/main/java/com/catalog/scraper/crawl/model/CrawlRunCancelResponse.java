package com.catalog.scraper.crawl.model;

public record CrawlRunCancelResponse(
    String runId,
    boolean cancelRequested
) {}
