package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.crawl.model.ScrapedRecord;

/**
 * Destination for scraped records. Called from a single writer thread. Inserting the same record key
 * twice must leave one stored record.
 */
public interface RecordSink {
    void open() throws SinkException;

    void insert(ScrapedRecord record) throws SinkException;

    void close() throws SinkException;

    /**
     * True when {@link #insert} only stages records and nothing is stored until {@link #close()}
     * succeeds.
     */
    default boolean commitsOnClose() {
        return false;
    }

    /**
     * Number of records stored by the last successful {@link #close()}. Only meaningful for sinks that
     * commit on close.
     */
    default int committedCount() {
        return 0;
    }

    /**
     * Key a record is stored under: the value of {@code keyField} when the record carries one, else its
     * source URL.
     */
    static String recordKey(ScrapedRecord record, String keyField) {
        if (keyField != null && !keyField.isBlank()) {
            Object value = record.field(keyField);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value).trim();
            }
        }
        return record.sourceUrl();
    }
}
