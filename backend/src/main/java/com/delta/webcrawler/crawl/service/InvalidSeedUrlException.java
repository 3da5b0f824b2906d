package com.delta.webcrawler.crawl.service;

public class InvalidSeedUrlException extends RuntimeException {
    private final String seedUrl;

    public InvalidSeedUrlException(String seedUrl) {
        super("Invalid seed URL: " + seedUrl + " (expected an absolute http(s) URL)");
        this.seedUrl = seedUrl;
    }

    public String getSeedUrl() {
        return seedUrl;
    }
}
