package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.extract.RecordExtractor;
import com.catalog.scraper.crawl.http.PageFetcher;
import com.catalog.scraper.crawl.http.Sleeper;
import com.catalog.scraper.crawl.model.CrawlSeed;
import com.catalog.scraper.crawl.model.CrawlTask;
import com.catalog.scraper.crawl.model.PipelineReport;
import com.catalog.scraper.crawl.model.PipelineState;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.catalog.scraper.crawl.model.StatsSnapshot;
import com.catalog.scraper.crawl.persistence.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one crawl run through {@code DISCOVERING -> DISPATCHING -> DRAINING} and settles it as
 * {@code DONE}, {@code CANCELLED} or {@code FAILED}. One instance per run.
 *
 * <p>Discovered tasks go to an unbounded frontier. This thread feeds them into the bounded work queue,
 * workers push records into the bounded result queue, and a single writer drains that into the sink.
 * The report always carries the counters, whatever the outcome.
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final String runId;
    private final ScraperProperties properties;
    private final List<CrawlSeed> seeds;
    private final PageFetcher fetcher;
    private final RecordExtractor extractor;
    private final RecordSink sink;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final PipelineStats stats = new PipelineStats();
    private final AtomicReference<String> writerFailure = new AtomicReference<>();

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile Instant startedAt;

    public PipelineOrchestrator(
        String runId,
        ScraperProperties properties,
        List<CrawlSeed> seeds,
        PageFetcher fetcher,
        RecordExtractor extractor,
        RecordSink sink,
        Sleeper sleeper,
        Clock clock
    ) {
        this.runId = runId;
        this.properties = properties;
        this.seeds = seeds == null ? List.of() : List.copyOf(seeds);
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.sink = sink;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public PipelineReport run() {
        startedAt = clock.instant();
        if (seeds.isEmpty()) {
            return finish(PipelineState.FAILED, "no seeds configured");
        }
        log.info(
            "Run {} starting: seeds={}, workers={}, queueCapacity={}, discovery={}",
            runId,
            seeds.size(),
            properties.getWorkerCount(),
            properties.effectiveQueueCapacity(),
            properties.getDiscoveryMode()
        );

        int capacity = properties.effectiveQueueCapacity();
        Frontier frontier = new Frontier();
        BoundedChannel<CrawlTask> workQueue = new BoundedChannel<>("work-queue", capacity);
        BoundedChannel<ScrapedRecord> resultQueue = new BoundedChannel<>("result-queue", capacity);
        shutdown.onRaise(() -> {
            long dropped = (long) frontier.close() + workQueue.closeAndClear();
            if (dropped > 0) {
                stats.tasksCancelled(dropped);
            }
            log.warn("Run {} shutting down ({}), dropped {} undispatched tasks", runId, shutdown.reason(), dropped);
        });

        LinkDiscoverer discoverer = new LinkDiscoverer(
            fetcher, extractor, frontier, stats, shutdown, properties.getMaxPagesPerCategory()
        );
        ScheduledExecutorService heartbeat = startHeartbeat(workQueue, resultQueue);
        ExecutorService writerExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("persistence-writer");
            thread.setDaemon(true);
            return thread;
        });
        try {
            state = PipelineState.DISCOVERING;
            if (properties.getDiscoveryMode() == DiscoveryMode.LAZY) {
                discoverer.seed(seeds);
            } else {
                discoverer.walkAll(seeds);
                if (!shutdown.isRaised() && !discoverer.anySeedReached()) {
                    frontier.close();
                    return finish(PipelineState.FAILED, discoveryFailureMessage(discoverer));
                }
            }
            frontier.seal();

            state = PipelineState.DISPATCHING;
            PersistenceWriter writer = new PersistenceWriter(
                resultQueue,
                sink,
                stats,
                sleeper,
                properties.getPersist().getMaxAttempts(),
                properties.getPersist().getMaxConsecutiveFailures(),
                Duration.ofMillis(properties.getPersist().getRetryDelayMs())
            );
            CompletableFuture<PersistenceWriter.WriterOutcome> writerFuture = CompletableFuture
                .supplyAsync(writer::run, writerExecutor)
                .whenComplete((outcome, error) -> {
                    if (error != null || outcome.fatal()) {
                        writerFailure.compareAndSet(null, error != null ? "writer crashed: " + error.getMessage() : outcome.message());
                        shutdown.raise("persistence failed");
                        resultQueue.closeAndClear();
                    }
                });

            WorkerPool workers = new WorkerPool(
                properties.getWorkerCount(),
                workQueue,
                resultQueue,
                fetcher,
                extractor,
                discoverer,
                frontier,
                stats,
                shutdown
            );
            workers.start();
            feed(frontier, workQueue);
            workQueue.close();
            workers.awaitCompletion();

            state = PipelineState.DRAINING;
            resultQueue.close();
            awaitWriter(writerFuture);

            if (writerFailure.get() != null) {
                return finish(PipelineState.FAILED, writerFailure.get());
            }
            if (shutdown.isRaised()) {
                return finish(PipelineState.CANCELLED, "shutdown: " + shutdown.reason());
            }
            if (!discoverer.anySeedReached()) {
                return finish(PipelineState.FAILED, discoveryFailureMessage(discoverer));
            }
            return finish(PipelineState.DONE, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown.raise("interrupted");
            resultQueue.close();
            return finish(PipelineState.CANCELLED, "shutdown: interrupted");
        } finally {
            heartbeat.shutdownNow();
            writerExecutor.shutdown();
        }
    }

    /**
     * Raises the cooperative shutdown signal. Undispatched tasks are dropped, in-flight fetches finish,
     * and records already queued are still written.
     */
    public boolean requestShutdown(String reason) {
        boolean raised = shutdown.raise(reason);
        if (raised) {
            log.info("Shutdown requested for run {}: {}", runId, reason);
        }
        return raised;
    }

    public String runId() {
        return runId;
    }

    public PipelineState state() {
        return state;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public StatsSnapshot currentStats() {
        return stats.snapshot();
    }

    private void feed(Frontier frontier, BoundedChannel<CrawlTask> workQueue) throws InterruptedException {
        while (true) {
            CrawlTask task = frontier.next();
            if (task == null) {
                return;
            }
            if (!workQueue.put(task)) {
                stats.taskCancelled();
                frontier.complete(task);
                return;
            }
        }
    }

    private void awaitWriter(CompletableFuture<PersistenceWriter.WriterOutcome> writerFuture) {
        try {
            writerFuture.join();
        } catch (CompletionException e) {
            writerFailure.compareAndSet(null, "writer crashed: " + e.getCause());
        }
    }

    private ScheduledExecutorService startHeartbeat(
        BoundedChannel<CrawlTask> workQueue,
        BoundedChannel<ScrapedRecord> resultQueue
    ) {
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-progress");
            thread.setDaemon(true);
            return thread;
        });
        long period = properties.getProgressLogSeconds();
        heartbeat.scheduleAtFixedRate(() -> {
            StatsSnapshot snapshot = stats.snapshot();
            log.info(
                "Run {} {}: attempted={}, succeeded={}, failed={}, written={}, {}, {}",
                runId,
                state,
                snapshot.attempted(),
                snapshot.succeeded(),
                snapshot.failed(),
                snapshot.recordsWritten(),
                workQueue,
                resultQueue
            );
        }, period, period, TimeUnit.SECONDS);
        return heartbeat;
    }

    private String discoveryFailureMessage(LinkDiscoverer discoverer) {
        return "discovery failed: no seed listing reachable (" + discoverer.seedsFailed() + " of " + seeds.size() + " seeds failed)";
    }

    private PipelineReport finish(PipelineState finalState, String message) {
        state = finalState;
        StatsSnapshot snapshot = stats.snapshot();
        PipelineReport report = new PipelineReport(runId, finalState, startedAt, clock.instant(), snapshot, message);
        if (finalState == PipelineState.DONE) {
            log.info(
                "Run {} DONE: attempted={}, succeeded={}, failed={}, written={}, parseFailures={}, duplicates={}",
                runId,
                snapshot.attempted(),
                snapshot.succeeded(),
                snapshot.failed(),
                snapshot.recordsWritten(),
                snapshot.parseFailures(),
                snapshot.duplicatesSkipped()
            );
        } else {
            log.warn(
                "Run {} {} ({}): attempted={}, succeeded={}, failed={}, written={}, persistFailures={}, cancelled={}",
                runId,
                finalState,
                message,
                snapshot.attempted(),
                snapshot.succeeded(),
                snapshot.failed(),
                snapshot.recordsWritten(),
                snapshot.persistFailures(),
                snapshot.cancelled()
            );
        }
        return report;
    }
}
