package com.catalog.scraper.crawl.api;

import com.catalog.scraper.crawl.service.ActiveCrawlRunException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class CrawlExceptionHandler {

    @ExceptionHandler(ActiveCrawlRunException.class)
    public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "active_crawl_run");
        body.put("message", ex.getMessage());
        body.put("activeRunId", ex.getActiveRunId());
        body.put("activeState", String.valueOf(ex.getActiveState()));
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
