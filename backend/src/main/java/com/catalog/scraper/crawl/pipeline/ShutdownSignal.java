package com.catalog.scraper.crawl.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative shutdown flag shared by every stage of one run. Raising it is idempotent; the first
 * reason wins.
 */
public final class ShutdownSignal {
    private static final ShutdownSignal NEVER = new ShutdownSignal();

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new ArrayList<>();

    public static ShutdownSignal never() {
        return NEVER;
    }

    public boolean raise(String why) {
        if (this == NEVER) {
            return false;
        }
        if (!reason.compareAndSet(null, why == null ? "shutdown requested" : why)) {
            return false;
        }
        List<Runnable> toRun;
        synchronized (listeners) {
            toRun = new ArrayList<>(listeners);
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
        return true;
    }

    public boolean isRaised() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * Registers a callback run once when the signal is raised, or immediately if it already was.
     */
    public void onRaise(Runnable listener) {
        synchronized (listeners) {
            if (!isRaised()) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
