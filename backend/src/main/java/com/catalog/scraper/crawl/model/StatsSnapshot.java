package com.catalog.scraper.crawl.model;

public record StatsSnapshot(
    long attempted,
    long succeeded,
    long failed,
    long recordsWritten,
    long parseFailures,
    long persistFailures,
    long cancelled,
    long duplicatesSkipped
) {}
