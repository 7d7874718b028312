package com.catalog.scraper.crawl;

import com.catalog.scraper.crawl.persistence.JdbcRecordSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private JdbcRecordSink jdbcRecordSink;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runsCollectionIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/runs"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void cancelWithoutActiveRunIsNotFound() throws Exception {
        mockMvc.perform(post("/api/runs/current/cancel"))
            .andExpect(status().isNotFound());
    }

    @Test
    void migratedSchemaIsReachable() throws Exception {
        jdbcRecordSink.open();
        assertThat(jdbcRecordSink.countRecords()).isGreaterThanOrEqualTo(0);
    }
}
