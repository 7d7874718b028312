package com.catalog.scraper.config;

import com.catalog.scraper.crawl.extract.BooksToScrapeExtractor;
import com.catalog.scraper.crawl.extract.SelectorSiteExtractor;
import com.catalog.scraper.crawl.extract.SiteExtractor;
import com.catalog.scraper.crawl.http.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getWorkerCount() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-run");
            return thread;
        });
    }

    @Bean
    public SiteExtractor siteExtractor(ScraperProperties properties) {
        String profile = properties.getSiteProfile().toLowerCase(Locale.ROOT);
        return switch (profile) {
            case "books" -> new BooksToScrapeExtractor();
            case "selectors" -> new SelectorSiteExtractor(properties.getSelectors());
            default -> throw new IllegalStateException("Unknown scraper.site-profile: " + properties.getSiteProfile());
        };
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
