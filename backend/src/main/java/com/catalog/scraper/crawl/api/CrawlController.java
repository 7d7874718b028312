package com.catalog.scraper.crawl.api;

import com.catalog.scraper.crawl.model.CrawlRunCancelResponse;
import com.catalog.scraper.crawl.model.CrawlRunStartResponse;
import com.catalog.scraper.crawl.model.PipelineReport;
import com.catalog.scraper.crawl.model.PipelineState;
import com.catalog.scraper.crawl.service.CrawlRunService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/runs")
public class CrawlController {
    private final CrawlRunService crawlRunService;

    public CrawlController(CrawlRunService crawlRunService) {
        this.crawlRunService = crawlRunService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CrawlRunStartResponse startRun() {
        String runId = crawlRunService.startAsync();
        return new CrawlRunStartResponse(runId, PipelineState.IDLE);
    }

    @GetMapping("/current")
    public PipelineReport currentRun() {
        return crawlRunService.current()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No crawl run has been started"));
    }

    @PostMapping("/current/cancel")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CrawlRunCancelResponse cancelRun() {
        String runId = crawlRunService.cancel("cancel requested via API")
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No active crawl run"));
        return new CrawlRunCancelResponse(runId, true);
    }
}
