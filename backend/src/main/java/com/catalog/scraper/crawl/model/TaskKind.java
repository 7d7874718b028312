package com.catalog.scraper.crawl.model;

public enum TaskKind {
    LISTING,
    DETAIL
}
