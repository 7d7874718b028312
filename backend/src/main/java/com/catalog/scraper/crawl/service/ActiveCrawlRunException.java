package com.catalog.scraper.crawl.service;

import com.catalog.scraper.crawl.model.PipelineState;

/**
 * Thrown when a run is requested while another one has not settled yet.
 */
public class ActiveCrawlRunException extends RuntimeException {
    private final String activeRunId;
    private final PipelineState activeState;

    public ActiveCrawlRunException(String activeRunId, PipelineState activeState) {
        super("Crawl run " + activeRunId + " is still " + activeState);
        this.activeRunId = activeRunId;
        this.activeState = activeState;
    }

    public String getActiveRunId() {
        return activeRunId;
    }

    public PipelineState getActiveState() {
        return activeState;
    }
}
