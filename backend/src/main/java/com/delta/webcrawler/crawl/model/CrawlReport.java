package com.delta.webcrawler.crawl.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
    "crawlRunId",
    "status",
    "baseUrl",
    "maxDepthReached",
    "pagesCrawled",
    "errorCount",
    "durationSeconds",
    "visitedUrls"
})
public record CrawlReport(
    long crawlRunId,
    CrawlRunStatus status,
    String baseUrl,
    int maxDepthReached,
    int pagesCrawled,
    int errorCount,
    double durationSeconds,
    List<String> visitedUrls
) {
    public CrawlReport {
        visitedUrls = visitedUrls == null ? List.of() : List.copyOf(visitedUrls);
    }
}
