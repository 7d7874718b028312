package com.catalog.scraper.crawl.model;

import java.util.List;

/**
 * Result of extracting one fetched page: a listing page, the records of a detail page, or a parse
 * failure. Exactly one of the three is set.
 */
public record ExtractionOutcome(
    ListingPage listing,
    List<ScrapedRecord> records,
    ParseFailure failure
) {
    public static ExtractionOutcome ofListing(ListingPage listing) {
        return new ExtractionOutcome(listing, List.of(), null);
    }

    public static ExtractionOutcome ofRecords(List<ScrapedRecord> records) {
        return new ExtractionOutcome(null, List.copyOf(records), null);
    }

    public static ExtractionOutcome failed(String url, String reason) {
        return new ExtractionOutcome(null, List.of(), new ParseFailure(url, reason));
    }

    public boolean isFailure() {
        return failure != null;
    }
}
