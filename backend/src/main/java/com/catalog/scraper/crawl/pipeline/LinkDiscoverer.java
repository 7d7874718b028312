package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.extract.RecordExtractor;
import com.catalog.scraper.crawl.http.PageFetcher;
import com.catalog.scraper.crawl.model.CrawlSeed;
import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.ExtractionOutcome;
import com.catalog.scraper.crawl.model.FetchResult;
import com.catalog.scraper.crawl.model.FetchStatus;
import com.catalog.scraper.crawl.model.ListingPage;
import com.catalog.scraper.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks paginated listings per seed and feeds detail tasks into the frontier. A seed's walk stops at
 * the first of: a page with no new detail links, a page without a next link, or the page limit.
 * Detail URLs are deduplicated across all seeds of the run.
 */
public class LinkDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(LinkDiscoverer.class);

    private final PageFetcher fetcher;
    private final RecordExtractor extractor;
    private final Frontier frontier;
    private final PipelineStats stats;
    private final ShutdownSignal shutdown;
    private final int maxPagesPerCategory;
    private final Set<String> seenDetailUrls = ConcurrentHashMap.newKeySet();
    private final Set<String> seenListingUrls = ConcurrentHashMap.newKeySet();
    private final AtomicInteger seedsReached = new AtomicInteger();
    private final AtomicInteger seedsFailed = new AtomicInteger();

    LinkDiscoverer(
        PageFetcher fetcher,
        RecordExtractor extractor,
        Frontier frontier,
        PipelineStats stats,
        ShutdownSignal shutdown,
        int maxPagesPerCategory
    ) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.frontier = frontier;
        this.stats = stats;
        this.shutdown = shutdown;
        this.maxPagesPerCategory = Math.max(1, maxPagesPerCategory);
    }

    /**
     * Eager strategy: fetches every listing page of every seed on the calling thread, leaving the full
     * detail set in the frontier.
     */
    void walkAll(List<CrawlSeed> seeds) {
        for (CrawlSeed seed : seeds) {
            if (shutdown.isRaised()) {
                return;
            }
            CrawlTask listing = firstPage(seed);
            while (listing != null && !shutdown.isRaised()) {
                listing = fetchListing(listing);
            }
        }
    }

    /**
     * Lazy strategy: queues only the first listing page per seed. Workers report each listing result
     * back through {@link #onListingPage}.
     */
    void seed(List<CrawlSeed> seeds) {
        for (CrawlSeed seed : seeds) {
            CrawlTask listing = firstPage(seed);
            if (listing != null) {
                frontier.add(listing);
            }
        }
    }

    void onListingPage(CrawlTask listingTask, ListingPage page) {
        listingReached(listingTask);
        CrawlTask next = accept(listingTask, page);
        if (next != null) {
            frontier.add(next);
        }
    }

    void onListingFailed(CrawlTask listingTask) {
        if (isFirstPage(listingTask)) {
            seedsFailed.incrementAndGet();
            log.warn("First listing page for category '{}' unreachable: {}", listingTask.category(), listingTask.url());
        }
    }

    boolean anySeedReached() {
        return seedsReached.get() > 0;
    }

    int seedsFailed() {
        return seedsFailed.get();
    }

    private CrawlTask fetchListing(CrawlTask listing) {
        stats.taskAttempted();
        FetchResult result = fetcher.fetch(listing, shutdown);
        if (result.status() == FetchStatus.CANCELLED) {
            stats.taskCancelled();
            return null;
        }
        if (!result.isOk()) {
            stats.taskFailed();
            log.warn("Listing page {} failed: {} {}", listing.url(), result.status(), result.statusCode());
            onListingFailed(listing);
            return null;
        }
        ExtractionOutcome outcome = extractor.extract(result);
        if (outcome.isFailure()) {
            stats.parseFailed();
            log.warn("Listing page {} could not be parsed: {}", listing.url(), outcome.failure().reason());
            onListingFailed(listing);
            return null;
        }
        stats.taskSucceeded();
        listingReached(listing);
        return accept(listing, outcome.listing());
    }

    /**
     * Adds the page's unseen detail links to the frontier and returns the next listing task, or null
     * when the walk for this seed is over.
     */
    private CrawlTask accept(CrawlTask listing, ListingPage page) {
        int pageIndex = listing.pageIndex() == null ? 1 : listing.pageIndex();
        int added = 0;
        for (String url : page.detailUrls()) {
            if (UrlUtils.toHttpUri(url) == null) {
                log.debug("Ignoring non-http detail link {} on {}", url, listing.url());
                continue;
            }
            if (!seenDetailUrls.add(UrlUtils.normalize(url))) {
                stats.duplicateSkipped();
                continue;
            }
            if (frontier.add(CrawlTask.detail(url, listing.category()))) {
                added++;
            }
        }
        log.info("Listing '{}' page {}: {} new detail links", listing.category(), pageIndex, added);

        if (added == 0) {
            log.info("Stopping '{}' at page {}: no new detail links", listing.category(), pageIndex);
            return null;
        }
        if (!page.hasNextPage()) {
            log.info("Stopping '{}' at page {}: no next page", listing.category(), pageIndex);
            return null;
        }
        if (pageIndex >= maxPagesPerCategory) {
            log.info("Stopping '{}' at page {}: page limit reached", listing.category(), pageIndex);
            return null;
        }
        String nextUrl = page.nextPageUrl();
        if (!seenListingUrls.add(UrlUtils.normalize(nextUrl))) {
            log.warn("Stopping '{}' at page {}: next page {} already visited", listing.category(), pageIndex, nextUrl);
            return null;
        }
        return CrawlTask.listing(nextUrl, pageIndex + 1, listing.category());
    }

    private CrawlTask firstPage(CrawlSeed seed) {
        if (seed.url() == null || seed.url().isBlank()) {
            log.warn("Skipping seed '{}' without a URL", seed.category());
            seedsFailed.incrementAndGet();
            return null;
        }
        seenListingUrls.add(UrlUtils.normalize(seed.url()));
        return CrawlTask.listing(seed.url().trim(), 1, seed.category());
    }

    private void listingReached(CrawlTask listing) {
        if (isFirstPage(listing)) {
            seedsReached.incrementAndGet();
        }
    }

    private static boolean isFirstPage(CrawlTask listing) {
        return listing.pageIndex() == null || listing.pageIndex() == 1;
    }
}
