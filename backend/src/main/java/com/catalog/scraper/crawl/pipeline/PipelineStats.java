package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.model.StatsSnapshot;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-wide counters. Workers and the writer update them concurrently; each counter is its own atomic.
 */
public final class PipelineStats {
    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong recordsWritten = new AtomicLong();
    private final AtomicLong parseFailures = new AtomicLong();
    private final AtomicLong persistFailures = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong duplicatesSkipped = new AtomicLong();

    void taskAttempted() {
        attempted.incrementAndGet();
    }

    void taskSucceeded() {
        succeeded.incrementAndGet();
    }

    void taskFailed() {
        failed.incrementAndGet();
    }

    void parseFailed() {
        parseFailures.incrementAndGet();
        failed.incrementAndGet();
    }

    void taskCancelled() {
        cancelled.incrementAndGet();
    }

    void tasksCancelled(long count) {
        cancelled.addAndGet(count);
    }

    void recordWritten() {
        recordsWritten.incrementAndGet();
    }

    void recordsWritten(long count) {
        recordsWritten.addAndGet(count);
    }

    void persistFailed() {
        persistFailures.incrementAndGet();
    }

    void duplicateSkipped() {
        duplicatesSkipped.incrementAndGet();
    }

    public StatsSnapshot snapshot() {
        return new StatsSnapshot(
            attempted.get(),
            succeeded.get(),
            failed.get(),
            recordsWritten.get(),
            parseFailures.get(),
            persistFailures.get(),
            cancelled.get(),
            duplicatesSkipped.get()
        );
    }
}
