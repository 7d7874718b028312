package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonDocumentSinkTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void writesOnePrettyArrayOnCloseWithLaterDuplicatesWinning() throws Exception {
        Path target = tempDir.resolve("out").resolve("books_data.json");
        JsonDocumentSink sink = new JsonDocumentSink(target, objectMapper, "");
        sink.open();

        sink.insert(record("https://books.example/a", "A", "£1.00"));
        sink.insert(record("https://books.example/b", "B", "£2.00"));
        sink.insert(record("https://books.example/a", "A", "£3.00"));
        assertThat(Files.exists(target)).isFalse();
        sink.close();

        String json = Files.readString(target);
        List<Map<String, Object>> written = objectMapper.readValue(json, new TypeReference<>() {});
        assertThat(written).hasSize(2);
        assertThat(written.get(0)).containsEntry("title", "A").containsEntry("price", "£3.00");
        assertThat(written.get(1)).containsEntry("title", "B");
        assertThat(json).contains(System.lineSeparator());
    }

    @Test
    void insertBeforeOpenIsRejected() {
        JsonDocumentSink sink = new JsonDocumentSink(tempDir.resolve("books.json"), objectMapper, "");

        assertThatThrownBy(() -> sink.insert(record("https://books.example/a", "A", "£1.00")))
            .isInstanceOf(SinkException.class);
    }

    @Test
    void emptyRunWritesEmptyArray() throws Exception {
        Path target = tempDir.resolve("books.json");
        JsonDocumentSink sink = new JsonDocumentSink(target, objectMapper, "title");
        sink.open();
        sink.close();

        assertThat(objectMapper.readTree(target.toFile()).isArray()).isTrue();
        assertThat(objectMapper.readTree(target.toFile()).size()).isZero();
    }

    private static ScrapedRecord record(String url, String title, String price) {
        return new ScrapedRecord(Map.of("title", title, "price", price), url, Instant.parse("2024-05-01T10:00:00Z"));
    }
}
