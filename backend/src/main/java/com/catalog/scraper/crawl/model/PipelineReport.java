package com.catalog.scraper.crawl.model;

import java.time.Instant;

public record PipelineReport(
    String runId,
    PipelineState state,
    Instant startedAt,
    Instant finishedAt,
    StatsSnapshot stats,
    String message
) {
    /**
     * Process exit code for a finished run: 0 on a clean drain, 1 on failure, 2 on a cooperative
     * shutdown that left work behind.
     */
    public int exitCode() {
        if (state == PipelineState.DONE) {
            return 0;
        }
        return state == PipelineState.CANCELLED ? 2 : 1;
    }
}
