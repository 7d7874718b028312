package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers records in memory and writes them as one pretty-printed JSON array when closed. A later
 * record with the same key replaces the earlier one in place.
 */
public class JsonDocumentSink implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(JsonDocumentSink.class);

    private final Path target;
    private final ObjectMapper objectMapper;
    private final String keyField;
    private final Map<String, Map<String, Object>> buffered = new LinkedHashMap<>();
    private boolean open;
    private int committed;

    public JsonDocumentSink(Path target, ObjectMapper objectMapper, String keyField) {
        this.target = target;
        this.objectMapper = objectMapper;
        this.keyField = keyField;
    }

    @Override
    public void open() throws SinkException {
        Path parent = target.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SinkException("cannot create output directory " + parent, e);
        }
        if (Files.exists(target) && !Files.isWritable(target)) {
            throw new SinkException("output file is not writable: " + target);
        }
        buffered.clear();
        committed = 0;
        open = true;
    }

    @Override
    public void insert(ScrapedRecord record) throws SinkException {
        if (!open) {
            throw new SinkException("sink is not open");
        }
        buffered.put(RecordSink.recordKey(record, keyField), record.fields());
    }

    @Override
    public void close() throws SinkException {
        if (!open) {
            return;
        }
        open = false;
        List<Map<String, Object>> document = new ArrayList<>(buffered.values());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new SinkException("cannot write " + target, e);
        }
        committed = document.size();
        log.info("Wrote {} records to {}", document.size(), target.toAbsolutePath());
    }

    @Override
    public boolean commitsOnClose() {
        return true;
    }

    @Override
    public int committedCount() {
        return committed;
    }
}
