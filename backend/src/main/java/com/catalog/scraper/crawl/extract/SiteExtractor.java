package com.catalog.scraper.crawl.extract;

import com.catalog.scraper.crawl.model.ListingPage;
import com.catalog.scraper.crawl.model.ScrapedRecord;

import java.time.Instant;

/**
 * Site-specific markup knowledge. Implementations must be deterministic for identical input and
 * resolve relative links against {@code pageUrl}.
 */
public interface SiteExtractor {
    ListingPage parseListing(String body, String pageUrl) throws ParseFailureException;

    ScrapedRecord parseDetail(String body, String pageUrl, String category, Instant scrapedAt)
        throws ParseFailureException;
}
