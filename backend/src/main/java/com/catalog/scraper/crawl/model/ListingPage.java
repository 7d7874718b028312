package com.catalog.scraper.crawl.model;

import java.util.List;

public record ListingPage(List<String> detailUrls, String nextPageUrl) {
    public ListingPage {
        detailUrls = detailUrls == null ? List.of() : List.copyOf(detailUrls);
    }

    public boolean hasNextPage() {
        return nextPageUrl != null && !nextPageUrl.isBlank();
    }
}
