package com.catalog.scraper.crawl.api;

import com.catalog.scraper.crawl.model.PipelineReport;
import com.catalog.scraper.crawl.model.PipelineState;
import com.catalog.scraper.crawl.model.StatsSnapshot;
import com.catalog.scraper.crawl.service.ActiveCrawlRunException;
import com.catalog.scraper.crawl.service.CrawlRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CrawlControllerTest {

    @Mock
    private CrawlRunService crawlRunService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CrawlController(crawlRunService))
            .setControllerAdvice(new CrawlExceptionHandler())
            .build();
    }

    @Test
    void startReturnsAcceptedWithRunId() throws Exception {
        when(crawlRunService.startAsync()).thenReturn("run-42");

        mockMvc.perform(post("/api/runs"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value("run-42"));
    }

    @Test
    void startWhileActiveIsConflict() throws Exception {
        when(crawlRunService.startAsync()).thenThrow(new ActiveCrawlRunException("run-41", PipelineState.DISPATCHING));

        mockMvc.perform(post("/api/runs"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_crawl_run"))
            .andExpect(jsonPath("$.message").value("Crawl run run-41 is still DISPATCHING"))
            .andExpect(jsonPath("$.activeRunId").value("run-41"))
            .andExpect(jsonPath("$.activeState").value("DISPATCHING"));
    }

    @Test
    void currentRunShowsStateAndCounters() throws Exception {
        PipelineReport report = new PipelineReport(
            "run-42",
            PipelineState.FAILED,
            Instant.parse("2024-05-01T10:00:00Z"),
            Instant.parse("2024-05-01T10:05:00Z"),
            new StatsSnapshot(5, 5, 0, 2, 0, 3, 0, 0),
            "sink unreachable"
        );
        when(crawlRunService.current()).thenReturn(Optional.of(report));

        mockMvc.perform(get("/api/runs/current"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value("run-42"))
            .andExpect(jsonPath("$.state").value("FAILED"))
            .andExpect(jsonPath("$.stats.recordsWritten").value(2))
            .andExpect(jsonPath("$.stats.attempted").value(5))
            .andExpect(jsonPath("$.message").value("sink unreachable"));
    }

    @Test
    void currentRunIsNotFoundBeforeAnyRun() throws Exception {
        when(crawlRunService.current()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/runs/current"))
            .andExpect(status().isNotFound());
    }

    @Test
    void cancelAcceptsWhenARunIsActive() throws Exception {
        when(crawlRunService.cancel(anyString())).thenReturn(Optional.of("run-42"));

        mockMvc.perform(post("/api/runs/current/cancel"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value("run-42"))
            .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    @Test
    void cancelWithoutActiveRunIsNotFound() throws Exception {
        when(crawlRunService.cancel(anyString())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/runs/current/cancel"))
            .andExpect(status().isNotFound());
    }
}
