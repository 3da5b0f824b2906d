package com.delta.webcrawler.crawl.model;

import com.delta.webcrawler.crawl.frontier.DomainPolicy;

public record CrawlRequest(
    String baseUrl,
    int maxDepth,
    int maxPages,
    int numWorkers,
    DomainPolicy domainPolicy
) {
    public CrawlRequest {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1");
        }
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1");
        }
        domainPolicy = domainPolicy == null ? DomainPolicy.SAME_HOST : domainPolicy;
    }

    public CrawlRequest(String baseUrl, int maxDepth, int maxPages, int numWorkers) {
        this(baseUrl, maxDepth, maxPages, numWorkers, DomainPolicy.SAME_HOST);
    }
}
