package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRecordSinkTest {
    @TempDir
    Path tempDir;

    private NamedParameterJdbcTemplate jdbc;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("products.db"));
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .load()
            .migrate();
        jdbc = new NamedParameterJdbcTemplate(dataSource);
        properties = new ScraperProperties();
    }

    @Test
    void reinsertingTheSameRecordUpsertsInsteadOfDuplicating() throws Exception {
        JdbcRecordSink sink = new JdbcRecordSink(jdbc, new ObjectMapper(), properties);
        sink.open();

        sink.insert(book("https://books.example/a", "A Light in the Attic", "£51.77", "2024-05-01T10:00:00Z"));
        sink.insert(book("https://books.example/b", "Tipping the Velvet", "£53.74", "2024-05-01T10:00:01Z"));
        sink.insert(book("https://books.example/a", "A Light in the Attic", "£49.00", "2024-05-02T10:00:00Z"));
        sink.close();

        assertThat(sink.countRecords()).isEqualTo(2);
        assertThat(sink.findFields("https://books.example/a")).containsEntry("price", "£49.00");
        assertThat(sink.findScrapedAt("https://books.example/a")).isEqualTo(Instant.parse("2024-05-02T10:00:00Z"));
        assertThat(sink.findFields("https://books.example/missing")).isNull();
    }

    @Test
    void keyFieldOverridesSourceUrlAsRecordKey() throws Exception {
        properties.getOutput().setKeyField("upc");
        JdbcRecordSink sink = new JdbcRecordSink(jdbc, new ObjectMapper(), properties);
        sink.open();

        ScrapedRecord first = book("https://books.example/a?ref=1", "A", "£1.00", "2024-05-01T10:00:00Z");
        ScrapedRecord second = book("https://books.example/a?ref=2", "A", "£2.00", "2024-05-01T11:00:00Z");
        sink.insert(withField(first, "upc", "a897fe39b1053632"));
        sink.insert(withField(second, "upc", "a897fe39b1053632"));

        assertThat(sink.countRecords()).isEqualTo(1);
        assertThat(sink.findFields("a897fe39b1053632")).containsEntry("price", "£2.00");
    }

    @Test
    void openFailsWhenDatabaseIsUnreachable() {
        SQLiteDataSource broken = new SQLiteDataSource();
        broken.setUrl("jdbc:sqlite:" + tempDir.resolve("missing-dir").resolve("nested").resolve("products.db"));
        JdbcRecordSink sink = new JdbcRecordSink(new NamedParameterJdbcTemplate(broken), new ObjectMapper(), properties);

        assertThatThrownBy(sink::open)
            .isInstanceOf(SinkException.class)
            .hasMessageStartingWith("database unreachable");
    }

    private static ScrapedRecord book(String url, String title, String price, String scrapedAt) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("category", "Poetry");
        fields.put("price", price);
        return new ScrapedRecord(fields, url, Instant.parse(scrapedAt));
    }

    private static ScrapedRecord withField(ScrapedRecord record, String name, Object value) {
        Map<String, Object> fields = new LinkedHashMap<>(record.fields());
        fields.put(name, value);
        return new ScrapedRecord(fields, record.sourceUrl(), record.scrapedAt());
    }
}
