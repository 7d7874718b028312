package com.catalog.scraper.crawl.extract;

public class ParseFailureException extends Exception {
    public ParseFailureException(String message) {
        super(message);
    }
}
