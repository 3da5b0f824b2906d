package com.delta.webcrawler.crawl.service;

public class CrawlUsageException extends RuntimeException {
    public CrawlUsageException(String message) {
        super(message);
    }
}
