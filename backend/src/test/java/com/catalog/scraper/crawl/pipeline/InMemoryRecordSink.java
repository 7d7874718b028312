package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.catalog.scraper.crawl.persistence.RecordSink;
import com.catalog.scraper.crawl.persistence.SinkException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records inserts in memory. {@link #failAfter(int)} makes every insert past the given number of
 * successes throw.
 */
class InMemoryRecordSink implements RecordSink {
    private final List<ScrapedRecord> records = new ArrayList<>();
    private final AtomicInteger insertCalls = new AtomicInteger();
    private volatile int successesBeforeFailure = Integer.MAX_VALUE;
    private volatile boolean failOpen;
    private volatile boolean opened;
    private volatile boolean closed;

    InMemoryRecordSink failAfter(int successes) {
        this.successesBeforeFailure = successes;
        return this;
    }

    InMemoryRecordSink failOpen() {
        this.failOpen = true;
        return this;
    }

    @Override
    public void open() throws SinkException {
        if (failOpen) {
            throw new SinkException("connection refused");
        }
        opened = true;
    }

    @Override
    public synchronized void insert(ScrapedRecord record) throws SinkException {
        insertCalls.incrementAndGet();
        if (records.size() >= successesBeforeFailure) {
            throw new SinkException("disk full");
        }
        records.add(record);
    }

    @Override
    public void close() {
        closed = true;
    }

    synchronized List<ScrapedRecord> records() {
        return new ArrayList<>(records);
    }

    int insertCalls() {
        return insertCalls.get();
    }

    boolean isOpened() {
        return opened;
    }

    boolean isClosed() {
        return closed;
    }
}
