package com.catalog.scraper.crawl.http;

import java.net.URI;

public record TransportResponse(int statusCode, String body, URI finalUri) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
