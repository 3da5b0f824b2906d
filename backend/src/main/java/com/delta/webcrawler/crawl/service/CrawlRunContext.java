package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.crawl.frontier.CrawlScope;
import com.delta.webcrawler.crawl.frontier.Frontier;
import com.delta.webcrawler.crawl.http.FetchRetryPolicy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run state shared by all workers of one crawl. Created by the coordinator at the start
 * of a run and dropped once the report is built.
 */
public record CrawlRunContext(
    long crawlRunId,
    Frontier frontier,
    CrawlScope scope,
    CrawlCounters counters,
    FetchRetryPolicy retryPolicy,
    Duration pollTimeout,
    AtomicBoolean stopRequested
) {
    public CrawlRunContext(
        long crawlRunId,
        Frontier frontier,
        CrawlScope scope,
        CrawlCounters counters,
        FetchRetryPolicy retryPolicy,
        Duration pollTimeout
    ) {
        this(crawlRunId, frontier, scope, counters, retryPolicy, pollTimeout, new AtomicBoolean(false));
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
