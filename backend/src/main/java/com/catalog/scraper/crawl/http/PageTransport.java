package com.catalog.scraper.crawl.http;

import java.io.IOException;

/**
 * Issues a single page load. Implementations may be plain HTTP or a headless browser; either way one
 * call is one network attempt with no retry of its own.
 */
public interface PageTransport {
    TransportResponse load(String url) throws IOException, InterruptedException;
}
