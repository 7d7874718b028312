package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.config.ScraperProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the sink for a run from {@code scraper.output.sink}. The JSON sink holds per-run state, so a
 * fresh one is built for every run.
 */
@Component
public class RecordSinkFactory {
    private final ScraperProperties properties;
    private final JdbcRecordSink jdbcRecordSink;
    private final ObjectMapper objectMapper;

    public RecordSinkFactory(ScraperProperties properties, JdbcRecordSink jdbcRecordSink, ObjectMapper objectMapper) {
        this.properties = properties;
        this.jdbcRecordSink = jdbcRecordSink;
        this.objectMapper = objectMapper;
    }

    public RecordSink create() {
        ScraperProperties.Output output = properties.getOutput();
        String sink = output.getSink().trim().toLowerCase(Locale.ROOT);
        return switch (sink) {
            case "jdbc" -> jdbcRecordSink;
            case "json" -> new JsonDocumentSink(Path.of(output.getJsonFile()), objectMapper, output.getKeyField());
            default -> throw new IllegalStateException("Unknown scraper.output.sink: " + output.getSink());
        };
    }
}
