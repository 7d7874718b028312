package com.catalog.scraper.crawl.pipeline;

import com.catalog.scraper.crawl.http.PageTransport;
import com.catalog.scraper.crawl.http.TransportResponse;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory site: URL to HTML body. Unknown URLs answer 404. Counts every load per URL.
 */
class StubPageTransport implements PageTransport {
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> loads = new ConcurrentHashMap<>();
    private final List<String> loadOrder = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> beforeLoad = url -> { };

    StubPageTransport page(String url, String body) {
        pages.put(url, body);
        return this;
    }

    StubPageTransport status(String url, int status) {
        statuses.put(url, status);
        return this;
    }

    StubPageTransport beforeLoad(Consumer<String> hook) {
        this.beforeLoad = hook;
        return this;
    }

    @Override
    public TransportResponse load(String url) throws IOException {
        loads.computeIfAbsent(url, ignored -> new AtomicInteger()).incrementAndGet();
        loadOrder.add(url);
        beforeLoad.accept(url);
        Integer status = statuses.get(url);
        if (status != null) {
            return new TransportResponse(status, "", URI.create(url));
        }
        String body = pages.get(url);
        if (body == null) {
            return new TransportResponse(404, "not found", URI.create(url));
        }
        return new TransportResponse(200, body, URI.create(url));
    }

    int loadCount(String url) {
        AtomicInteger count = loads.get(url);
        return count == null ? 0 : count.get();
    }

    Map<String, AtomicInteger> loads() {
        return loads;
    }

    List<String> loadOrder() {
        return loadOrder;
    }
}
