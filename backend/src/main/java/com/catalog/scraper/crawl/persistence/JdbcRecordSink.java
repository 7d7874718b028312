package com.catalog.scraper.crawl.persistence;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upserts records into {@code scraped_records}. The table is created by Flyway; re-inserting a key
 * replaces the stored fields, so re-running a crawl does not duplicate rows.
 */
@Repository
public class JdbcRecordSink implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcRecordSink.class);
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private static final String UPSERT_SQL = """
        INSERT INTO scraped_records (record_key, source_url, category, fields_json, scraped_at)
        VALUES (:recordKey, :sourceUrl, :category, :fieldsJson, :scrapedAt)
        ON CONFLICT (record_key) DO UPDATE SET
            source_url = excluded.source_url,
            category = excluded.category,
            fields_json = excluded.fields_json,
            scraped_at = excluded.scraped_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final String keyField;

    public JdbcRecordSink(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, ScraperProperties properties) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.keyField = properties.getOutput().getKeyField();
    }

    @Override
    public void open() throws SinkException {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            if (value == null || value != 1) {
                throw new SinkException("database did not answer SELECT 1");
            }
        } catch (DataAccessException e) {
            throw new SinkException("database unreachable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public void insert(ScrapedRecord record) throws SinkException {
        String fieldsJson;
        try {
            fieldsJson = objectMapper.writeValueAsString(record.fields());
        } catch (JsonProcessingException e) {
            throw new SinkException("record fields are not serializable: " + record.sourceUrl(), e);
        }
        Object category = record.field("category");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("recordKey", RecordSink.recordKey(record, keyField))
            .addValue("sourceUrl", record.sourceUrl())
            .addValue("category", category == null ? null : String.valueOf(category))
            .addValue("fieldsJson", fieldsJson)
            .addValue("scrapedAt", record.scrapedAt() == null ? null : record.scrapedAt().toString());
        try {
            jdbc.update(UPSERT_SQL, params);
        } catch (DataAccessException e) {
            throw new SinkException("insert failed for " + record.sourceUrl() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public void close() {
        log.debug("JDBC sink closed");
    }

    public long countRecords() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM scraped_records", Long.class);
        return count == null ? 0L : count;
    }

    public Map<String, Object> findFields(String recordKey) {
        try {
            String json = jdbc.queryForObject(
                "SELECT fields_json FROM scraped_records WHERE record_key = :recordKey",
                new MapSqlParameterSource("recordKey", recordKey),
                String.class
            );
            return json == null ? Map.of() : objectMapper.readValue(json, FIELD_MAP);
        } catch (EmptyResultDataAccessException e) {
            return null;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored fields for " + recordKey + " are not valid JSON", e);
        }
    }

    public Instant findScrapedAt(String recordKey) {
        try {
            String value = jdbc.queryForObject(
                "SELECT scraped_at FROM scraped_records WHERE record_key = :recordKey",
                new MapSqlParameterSource("recordKey", recordKey),
                String.class
            );
            return value == null ? null : Instant.parse(value);
        } catch (EmptyResultDataAccessException e) {
            return null;
        }
    }
}
