package com.delta.webcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one processed URL. {@code content} is the decoded body of a successful fetch,
 * already bounded by the fetch byte cap, and {@code null} for every other status.
 */
public record PageResult(
    String url,
    int depth,
    PageStatus status,
    Integer httpStatusCode,
    String errorMessage,
    Instant fetchedAt,
    List<String> links,
    String content
) {
    public PageResult {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static PageResult success(FrontierItem item, int httpStatusCode, Instant fetchedAt, List<String> links, String content) {
        return new PageResult(item.url(), item.depth(), PageStatus.SUCCESS, httpStatusCode, null, fetchedAt, links, content);
    }

    public static PageResult skipped(FrontierItem item, int httpStatusCode, Instant fetchedAt, String reason) {
        return new PageResult(item.url(), item.depth(), PageStatus.SKIPPED, httpStatusCode, reason, fetchedAt, List.of(), null);
    }

    public static PageResult fetchError(FrontierItem item, Integer httpStatusCode, Instant fetchedAt, String message) {
        return new PageResult(item.url(), item.depth(), PageStatus.FETCH_ERROR, httpStatusCode, message, fetchedAt, List.of(), null);
    }

    public static PageResult parseError(FrontierItem item, int httpStatusCode, Instant fetchedAt, String message) {
        return new PageResult(item.url(), item.depth(), PageStatus.PARSE_ERROR, httpStatusCode, message, fetchedAt, List.of(), null);
    }
}
