package com.catalog.scraper.crawl.service;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.PipelineReport;
import com.catalog.scraper.crawl.model.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final ScraperProperties properties;
    private final CrawlRunService crawlRunService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        ScraperProperties properties,
        CrawlRunService crawlRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlRunService = crawlRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread interruptHook = new Thread(() -> {
            if (crawlRunService.cancel("interrupt signal").isPresent()) {
                try {
                    finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "crawl-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(interruptHook);

        PipelineReport report;
        try {
            report = crawlRunService.run();
        } finally {
            finished.countDown();
        }
        StatsSnapshot stats = report.stats();
        log.info("Crawl run {} finished with state {}", report.runId(), report.state());
        log.info(
            "Summary: attempted={}, succeeded={}, failed={}, recordsWritten={}, parseFailures={}, persistFailures={}, cancelled={}, duplicatesSkipped={}",
            stats.attempted(),
            stats.succeeded(),
            stats.failed(),
            stats.recordsWritten(),
            stats.parseFailures(),
            stats.persistFailures(),
            stats.cancelled(),
            stats.duplicatesSkipped()
        );
        if (report.message() != null) {
            log.info("Detail: {}", report.message());
        }

        if (properties.getCli().isExitAfterRun()) {
            try {
                Runtime.getRuntime().removeShutdownHook(interruptHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
            int exitCode = SpringApplication.exit(applicationContext, report::exitCode);
            System.exit(exitCode);
        }
    }
}
