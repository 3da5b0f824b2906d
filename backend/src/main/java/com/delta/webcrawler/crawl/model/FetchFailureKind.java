package com.delta.webcrawler.crawl.model;

public enum FetchFailureKind {
    /** DNS, connect, TLS, timeout or a malformed request URL. */
    NETWORK_ERROR,
    /** The server answered with a 4xx or 5xx status. */
    HTTP_ERROR,
    /** The body exceeded the configured byte cap. */
    TOO_LARGE
}
