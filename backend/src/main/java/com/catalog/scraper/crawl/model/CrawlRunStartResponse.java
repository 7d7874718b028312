package com.catalog.scraper.crawl.model;

public record CrawlRunStartResponse(
    String runId,
    PipelineState state
) {}
