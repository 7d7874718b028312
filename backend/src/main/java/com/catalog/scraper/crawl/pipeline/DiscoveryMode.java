package com.catalog.scraper.crawl.pipeline;

/**
 * How listing pagination is walked. {@code EAGER} collects every detail URL before workers start;
 * {@code LAZY} interleaves listing pages with detail fetches on the worker pool.
 */
public enum DiscoveryMode {
    EAGER,
    LAZY
}
