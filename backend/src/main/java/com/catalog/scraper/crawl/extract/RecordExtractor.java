package com.catalog.scraper.crawl.extract;

import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.ExtractionOutcome;
import com.catalog.scraper.crawl.model.FetchResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Turns a successful fetch into an {@link ExtractionOutcome}. Total over its input: malformed markup,
 * a blank body or any fault inside the site extractor comes back as a parse failure.
 */
@Component
public class RecordExtractor {
    private final SiteExtractor siteExtractor;

    public RecordExtractor(SiteExtractor siteExtractor) {
        this.siteExtractor = siteExtractor;
    }

    public ExtractionOutcome extract(FetchResult result) {
        CrawlTask task = result.task();
        if (!result.isOk()) {
            return ExtractionOutcome.failed(task.url(), "fetch_" + result.status().name().toLowerCase(Locale.ROOT));
        }
        String body = result.body();
        if (body == null || body.isBlank()) {
            return ExtractionOutcome.failed(task.url(), "empty_body");
        }
        try {
            if (task.isListing()) {
                return ExtractionOutcome.ofListing(siteExtractor.parseListing(body, task.url()));
            }
            return ExtractionOutcome.ofRecords(List.of(
                siteExtractor.parseDetail(body, task.url(), task.category(), result.fetchedAt())
            ));
        } catch (ParseFailureException e) {
            return ExtractionOutcome.failed(task.url(), e.getMessage());
        } catch (RuntimeException e) {
            return ExtractionOutcome.failed(task.url(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
