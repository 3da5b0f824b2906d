package com.delta.webcrawler.crawl.model;

/**
 * A normalized URL waiting in the frontier, with the link distance from the seed.
 */
public record FrontierItem(String url, int depth) {
    public FrontierItem {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
    }
}
