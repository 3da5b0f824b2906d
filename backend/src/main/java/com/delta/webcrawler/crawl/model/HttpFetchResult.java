package com.delta.webcrawler.crawl.model;

import java.net.URI;
import java.time.Instant;

/**
 * Raw answer of one GET. A transport-level failure has an {@code errorCode} and no body; an
 * HTTP error status is still a response and carries no error code.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String contentType,
    String body,
    Instant fetchedAt,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult response(String requestedUrl, URI finalUri, int statusCode, String contentType, String body, Instant fetchedAt) {
        return new HttpFetchResult(requestedUrl, finalUri, statusCode, contentType, body, fetchedAt, null, null);
    }

    public static HttpFetchResult failure(String requestedUrl, int statusCode, String errorCode, String errorMessage, Instant fetchedAt) {
        return new HttpFetchResult(requestedUrl, null, statusCode, null, null, fetchedAt, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUri == null ? requestedUrl : finalUri.toString();
    }
}
