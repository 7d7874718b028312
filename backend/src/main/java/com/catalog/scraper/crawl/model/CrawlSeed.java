package com.catalog.scraper.crawl.model;

public record CrawlSeed(String category, String url) {}
