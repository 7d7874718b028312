package com.catalog.scraper.crawl.persistence;

/**
 * Raised by a {@link RecordSink} when it cannot open, write or flush. The writer decides whether the
 * failure is retried, counted or fatal.
 */
public class SinkException extends Exception {
    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
