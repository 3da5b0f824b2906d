package com.delta.webcrawler.crawl.model;

public enum PageStatus {
    SUCCESS,
    FETCH_ERROR,
    PARSE_ERROR,
    SKIPPED;

    public boolean isError() {
        return this == FETCH_ERROR || this == PARSE_ERROR;
    }
}
