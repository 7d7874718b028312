package com.catalog.scraper.crawl.pipeline;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closeable FIFO shared between pipeline stages. Producers block while it is full; consumers
 * block while it is empty. After {@link #close()} no item is accepted, blocked producers are released
 * with {@code false}, and consumers drain what is left before {@link #take()} returns {@code null}.
 */
public final class BoundedChannel<T> {
    private final String name;
    private final int capacity;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public BoundedChannel(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Blocks until there is room. Returns false if the channel is, or becomes, closed.
     */
    public boolean put(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                notFull.await();
            }
            return enqueue(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for room. Returns false when the wait times out or the channel is
     * closed; the item is then not enqueued.
     */
    public boolean offer(T item, long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            return enqueue(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available. Returns null once the channel is closed and empty.
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return item;
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel and discards anything still queued. Returns the number of items dropped.
     */
    public int closeAndClear() {
        lock.lock();
        try {
            int dropped = items.size();
            items.clear();
            closed = true;
            notFull.signalAll();
            notEmpty.signalAll();
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return name + "[" + size() + "/" + capacity + "]";
    }

    private boolean enqueue(T item) {
        if (closed) {
            return false;
        }
        items.addLast(item);
        notEmpty.signal();
        return true;
    }
}
