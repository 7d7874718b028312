package com.catalog.scraper.crawl.model;

public enum PipelineState {
    IDLE,
    DISCOVERING,
    DISPATCHING,
    DRAINING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
