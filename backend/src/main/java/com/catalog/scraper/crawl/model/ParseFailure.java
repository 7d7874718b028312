package com.catalog.scraper.crawl.model;

public record ParseFailure(String url, String reason) {}
