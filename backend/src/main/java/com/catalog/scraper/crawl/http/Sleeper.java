package com.catalog.scraper.crawl.http;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts. Tests substitute a recording implementation so no real
 * time passes.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long millis = duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
