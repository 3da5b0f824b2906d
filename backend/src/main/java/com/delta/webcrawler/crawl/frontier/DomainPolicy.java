package com.delta.webcrawler.crawl.frontier;

public enum DomainPolicy {
    /** Only links whose host and explicit port equal the seed's; http and https of one host both match. */
    SAME_HOST,
    /** The seed's host and any of its subdomains; a leading {@code www.} on the seed is ignored. */
    SAME_DOMAIN,
    /** Any http(s) link. */
    ALL
}
