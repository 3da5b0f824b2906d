package com.delta.webcrawler.crawl.model;

import java.time.Instant;

/**
 * Result of a single GET. Exactly one of {@code body} or {@code failureKind} is meaningful:
 * a successful outcome has no failure kind, a failed one has no body.
 */
public record FetchOutcome(
    String url,
    String finalUrl,
    int statusCode,
    String body,
    String contentType,
    FetchFailureKind failureKind,
    String errorMessage,
    Instant fetchedAt
) {
    public static FetchOutcome ok(String url, String finalUrl, int statusCode, String body, String contentType, Instant fetchedAt) {
        return new FetchOutcome(url, finalUrl, statusCode, body, contentType, null, null, fetchedAt);
    }

    public static FetchOutcome failed(String url, int statusCode, FetchFailureKind kind, String message, Instant fetchedAt) {
        return new FetchOutcome(url, url, statusCode, null, null, kind, message, fetchedAt);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public Integer statusCodeOrNull() {
        return statusCode > 0 ? statusCode : null;
    }
}
