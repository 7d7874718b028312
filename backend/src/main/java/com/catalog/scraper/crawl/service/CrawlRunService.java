package com.catalog.scraper.crawl.service;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.extract.RecordExtractor;
import com.catalog.scraper.crawl.http.PageFetcher;
import com.catalog.scraper.crawl.http.Sleeper;
import com.catalog.scraper.crawl.model.CrawlSeed;
import com.catalog.scraper.crawl.model.PipelineReport;
import com.catalog.scraper.crawl.model.PipelineState;
import com.catalog.scraper.crawl.persistence.RecordSinkFactory;
import com.catalog.scraper.crawl.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Owns the single active crawl run of this process. Runs are started synchronously (CLI) or on the
 * crawl-run executor (API); a second start while one is active is rejected.
 */
@Service
public class CrawlRunService {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunService.class);

    private final ScraperProperties properties;
    private final PageFetcher fetcher;
    private final RecordExtractor extractor;
    private final RecordSinkFactory sinkFactory;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService crawlRunExecutor;
    private final Object lifecycleLock = new Object();

    private PipelineOrchestrator active;
    private PipelineReport lastReport;

    public CrawlRunService(
        ScraperProperties properties,
        PageFetcher fetcher,
        RecordExtractor extractor,
        RecordSinkFactory sinkFactory,
        Sleeper sleeper,
        Clock clock,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.sinkFactory = sinkFactory;
        this.sleeper = sleeper;
        this.clock = clock;
        this.crawlRunExecutor = crawlRunExecutor;
    }

    public PipelineReport run() {
        return execute(begin());
    }

    public String startAsync() {
        PipelineOrchestrator orchestrator = begin();
        crawlRunExecutor.submit(() -> execute(orchestrator));
        return orchestrator.runId();
    }

    /**
     * Live view of the active run, or the report of the last finished one.
     */
    public Optional<PipelineReport> current() {
        synchronized (lifecycleLock) {
            if (active != null) {
                return Optional.of(new PipelineReport(
                    active.runId(),
                    active.state(),
                    active.startedAt(),
                    null,
                    active.currentStats(),
                    null
                ));
            }
            return Optional.ofNullable(lastReport);
        }
    }

    public Optional<String> cancel(String reason) {
        PipelineOrchestrator orchestrator;
        synchronized (lifecycleLock) {
            orchestrator = active;
        }
        if (orchestrator == null) {
            return Optional.empty();
        }
        orchestrator.requestShutdown(reason);
        return Optional.of(orchestrator.runId());
    }

    private PipelineOrchestrator begin() {
        synchronized (lifecycleLock) {
            if (active != null) {
                throw new ActiveCrawlRunException(active.runId(), active.state());
            }
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                UUID.randomUUID().toString(),
                properties,
                seeds(),
                fetcher,
                extractor,
                sinkFactory.create(),
                sleeper,
                clock
            );
            active = orchestrator;
            return orchestrator;
        }
    }

    private PipelineReport execute(PipelineOrchestrator orchestrator) {
        PipelineReport report;
        try {
            report = orchestrator.run();
        } catch (RuntimeException e) {
            log.error("Crawl run {} crashed", orchestrator.runId(), e);
            report = new PipelineReport(
                orchestrator.runId(),
                PipelineState.FAILED,
                orchestrator.startedAt(),
                clock.instant(),
                orchestrator.currentStats(),
                "run crashed: " + e.getMessage()
            );
        }
        synchronized (lifecycleLock) {
            if (active == orchestrator) {
                active = null;
            }
            lastReport = report;
        }
        return report;
    }

    private List<CrawlSeed> seeds() {
        return properties.getSeeds().stream()
            .map(seed -> new CrawlSeed(seed.getCategory(), seed.getUrl()))
            .toList();
    }
}
