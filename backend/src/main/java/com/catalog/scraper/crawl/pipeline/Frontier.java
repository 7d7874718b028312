package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.model.CrawlTask;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Discovered tasks that have not been dispatched yet, plus the count of tasks still outstanding
 * (added but not yet completed by a worker). Once sealed, the frontier is exhausted when nothing is
 * outstanding: no worker can produce further pagination continuations at that point.
 *
 * <p>Workers add continuations here rather than to the bounded work queue, so a worker never blocks
 * on the queue it consumes from.
 */
final class Frontier {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<CrawlTask> pending = new ArrayDeque<>();
    private long outstanding;
    private boolean sealed;
    private boolean closed;

    boolean add(CrawlTask task) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            pending.addLast(task);
            outstanding++;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of externally supplied seeds. From here on only completing tasks add new ones.
     */
    void seal() {
        lock.lock();
        try {
            sealed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a task is available. Returns null when closed, or when sealed with nothing left
     * outstanding.
     */
    CrawlTask next() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && pending.isEmpty() && !(sealed && outstanding == 0)) {
                changed.await();
            }
            return closed ? null : pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    void complete(CrawlTask task) {
        lock.lock();
        try {
            if (outstanding > 0) {
                outstanding--;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting tasks and drops the undispatched ones. Returns how many were dropped.
     */
    int close() {
        lock.lock();
        try {
            int dropped = pending.size();
            pending.clear();
            closed = true;
            changed.signalAll();
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
