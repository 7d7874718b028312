package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.extract.RecordExtractor;
import com.catalog.scraper.crawl.http.PageFetcher;
import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.ExtractionOutcome;
import com.catalog.scraper.crawl.model.FetchResult;
import com.catalog.scraper.crawl.model.FetchStatus;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of workers draining the work queue. Each task is fetched (retry lives in the fetcher),
 * extracted, and its records pushed to the result queue. Failures are counted, never rethrown.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int workerCount;
    private final BoundedChannel<CrawlTask> workQueue;
    private final BoundedChannel<ScrapedRecord> resultQueue;
    private final PageFetcher fetcher;
    private final RecordExtractor extractor;
    private final LinkDiscoverer discoverer;
    private final Frontier frontier;
    private final PipelineStats stats;
    private final ShutdownSignal shutdown;

    private ExecutorService executor;

    WorkerPool(
        int workerCount,
        BoundedChannel<CrawlTask> workQueue,
        BoundedChannel<ScrapedRecord> resultQueue,
        PageFetcher fetcher,
        RecordExtractor extractor,
        LinkDiscoverer discoverer,
        Frontier frontier,
        PipelineStats stats,
        ShutdownSignal shutdown
    ) {
        this.workerCount = Math.max(1, workerCount);
        this.workQueue = workQueue;
        this.resultQueue = resultQueue;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.discoverer = discoverer;
        this.frontier = frontier;
        this.stats = stats;
        this.shutdown = shutdown;
    }

    void start() {
        executor = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-worker");
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workerCount; i++) {
            int workerIndex = i + 1;
            executor.submit(() -> workerLoop(workerIndex));
        }
    }

    /**
     * Waits for every worker to return. Workers return once the work queue is closed and empty, or the
     * shutdown signal is raised.
     */
    void awaitCompletion() throws InterruptedException {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for workers, {}", workQueue);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    private void workerLoop(int workerIndex) {
        Thread.currentThread().setName("crawl-worker-" + workerIndex);
        while (!Thread.currentThread().isInterrupted()) {
            CrawlTask task;
            try {
                task = workQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                return;
            }
            try {
                if (shutdown.isRaised()) {
                    stats.taskCancelled();
                    return;
                }
                process(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                stats.taskFailed();
                log.warn("Worker {} failed on {}", workerIndex, task.url(), e);
            } finally {
                frontier.complete(task);
            }
        }
    }

    private void process(CrawlTask task) throws InterruptedException {
        stats.taskAttempted();
        FetchResult result = fetcher.fetch(task, shutdown);
        if (result.status() == FetchStatus.CANCELLED) {
            stats.taskCancelled();
            return;
        }
        if (!result.isOk()) {
            stats.taskFailed();
            log.warn("Fetch failed for {} after {} attempts: {} {}",
                task.url(), result.attempts(), result.status(), result.statusCode());
            if (task.isListing()) {
                discoverer.onListingFailed(task);
            }
            return;
        }

        ExtractionOutcome outcome = extractor.extract(result);
        if (outcome.isFailure()) {
            stats.parseFailed();
            log.warn("Parse failure for {}: {}", task.url(), outcome.failure().reason());
            if (task.isListing()) {
                discoverer.onListingFailed(task);
            }
            return;
        }
        stats.taskSucceeded();

        if (task.isListing()) {
            discoverer.onListingPage(task, outcome.listing());
            return;
        }
        for (ScrapedRecord record : outcome.records()) {
            if (!resultQueue.put(record)) {
                log.warn("Result queue closed, dropping record from {}", record.sourceUrl());
                return;
            }
        }
    }
}
