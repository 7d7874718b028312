package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.http.Sleeper;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.catalog.scraper.crawl.persistence.RecordSink;
import com.catalog.scraper.crawl.persistence.SinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Single consumer of the result queue. A record that fails {@code maxAttempts} inserts is counted as a
 * persist failure; {@code maxConsecutiveFailures} such records in a row mean the sink is gone, and the
 * writer stops with a fatal outcome. A run of failures that reaches the end of the queue is fatal too,
 * since no later insert showed the sink recovered.
 *
 * <p>For sinks that commit on close, {@code recordsWritten} is taken from the sink after a successful
 * close rather than counted per insert.
 */
public class PersistenceWriter {
    private static final Logger log = LoggerFactory.getLogger(PersistenceWriter.class);

    private final BoundedChannel<ScrapedRecord> resultQueue;
    private final RecordSink sink;
    private final PipelineStats stats;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final int maxConsecutiveFailures;
    private final Duration retryDelay;

    PersistenceWriter(
        BoundedChannel<ScrapedRecord> resultQueue,
        RecordSink sink,
        PipelineStats stats,
        Sleeper sleeper,
        int maxAttempts,
        int maxConsecutiveFailures,
        Duration retryDelay
    ) {
        this.resultQueue = resultQueue;
        this.sink = sink;
        this.stats = stats;
        this.sleeper = sleeper;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        this.retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    /**
     * Drains the result queue until it is closed and empty, or until the sink is declared unreachable.
     */
    WriterOutcome run() {
        String openFailure = openSink();
        if (openFailure != null) {
            return WriterOutcome.fatal(openFailure);
        }

        boolean staged = sink.commitsOnClose();
        String fatal = null;
        try {
            fatal = drain(staged);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fatal = "writer interrupted";
        } finally {
            try {
                sink.close();
                if (staged) {
                    stats.recordsWritten(sink.committedCount());
                }
            } catch (SinkException e) {
                log.error("Closing sink failed: {}", e.getMessage(), e);
                if (fatal == null) {
                    fatal = "sink close failed: " + e.getMessage();
                }
            }
        }
        return fatal == null ? WriterOutcome.ok() : WriterOutcome.fatal(fatal);
    }

    private String openSink() {
        SinkException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sink.open();
                return null;
            } catch (SinkException e) {
                last = e;
                log.warn("Opening sink failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !pause()) {
                break;
            }
        }
        String message = "sink unreachable: " + (last == null ? "interrupted" : last.getMessage());
        log.error(message);
        return message;
    }

    private String drain(boolean staged) throws InterruptedException {
        int consecutiveFailures = 0;
        while (true) {
            ScrapedRecord record = resultQueue.take();
            if (record == null) {
                if (consecutiveFailures > 0) {
                    String message = "sink unreachable: last " + consecutiveFailures + " record(s) failed to persist";
                    log.error(message);
                    return message;
                }
                return null;
            }
            if (write(record)) {
                if (!staged) {
                    stats.recordWritten();
                }
                consecutiveFailures = 0;
                continue;
            }
            stats.persistFailed();
            consecutiveFailures++;
            if (consecutiveFailures >= maxConsecutiveFailures) {
                String message = "sink unreachable: " + consecutiveFailures + " consecutive records failed to persist";
                log.error(message);
                return message;
            }
        }
    }

    private boolean write(ScrapedRecord record) throws InterruptedException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sink.insert(record);
                return true;
            } catch (SinkException e) {
                log.warn("Persist attempt {}/{} failed for {}: {}", attempt, maxAttempts, record.sourceUrl(), e.getMessage());
            }
            if (attempt < maxAttempts) {
                sleeper.sleep(retryDelay);
            }
        }
        return false;
    }

    private boolean pause() {
        try {
            sleeper.sleep(retryDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    record WriterOutcome(boolean fatal, String message) {
        static WriterOutcome ok() {
            return new WriterOutcome(false, null);
        }

        static WriterOutcome fatal(String message) {
            return new WriterOutcome(true, message);
        }
    }
}
