package com.delta.webcrawler.crawl.model;

public enum CrawlRunStatus {
    RUNNING,
    COMPLETED,
    STOPPED,
    FAILED
}
