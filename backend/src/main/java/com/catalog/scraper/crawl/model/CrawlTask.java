package com.catalog.scraper.crawl.model;

/**
 * One unit of crawl work. {@code pageIndex} is set for listing pages only (1-based).
 */
public record CrawlTask(
    String url,
    TaskKind kind,
    Integer pageIndex,
    String category
) {
    public static CrawlTask listing(String url, int pageIndex, String category) {
        return new CrawlTask(url, TaskKind.LISTING, pageIndex, category);
    }

    public static CrawlTask detail(String url, String category) {
        return new CrawlTask(url, TaskKind.DETAIL, null, category);
    }

    public boolean isListing() {
        return kind == TaskKind.LISTING;
    }
}
