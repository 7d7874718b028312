package com.catalog.scraper.crawl.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structured result extracted from one detail page. Field names and values are site-specific and
 * opaque to the pipeline. Nested maps and lists are copied, so the record is immutable all the way
 * down.
 */
public record ScrapedRecord(
    Map<String, Object> fields,
    String sourceUrl,
    Instant scrapedAt
) {
    public ScrapedRecord {
        fields = fields == null ? Map.of() : copyMap(fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
