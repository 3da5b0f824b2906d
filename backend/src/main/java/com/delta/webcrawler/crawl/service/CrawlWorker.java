package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.crawl.extract.HtmlParseException;
import com.delta.webcrawler.crawl.extract.LinkExtractor;
import com.delta.webcrawler.crawl.frontier.Frontier;
import com.delta.webcrawler.crawl.http.PageFetcher;
import com.delta.webcrawler.crawl.model.ExtractedLinks;
import com.delta.webcrawler.crawl.model.FetchOutcome;
import com.delta.webcrawler.crawl.model.FrontierItem;
import com.delta.webcrawler.crawl.model.PageResult;
import com.delta.webcrawler.crawl.util.ReasonCodeClassifier;
import com.delta.webcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One fetch-extract-push loop. Every item popped from the frontier yields exactly one
 * {@link PageResult}; page-level failures are recorded and never end the loop.
 *
 * <p>The loop exits when no page slot can be reserved (budget reached), when the frontier is
 * drained, or when the run is stopped. Fetching and extraction happen outside any lock.
 */
public class CrawlWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);

    private final int workerId;
    private final CrawlRunContext context;
    private final PageFetcher fetcher;
    private final LinkExtractor extractor;
    private final ResultStore store;
    private final Clock clock;
    private volatile WorkerState state = WorkerState.IDLE;
    private volatile int pagesHandled;

    public CrawlWorker(
        int workerId,
        CrawlRunContext context,
        PageFetcher fetcher,
        LinkExtractor extractor,
        ResultStore store,
        Clock clock
    ) {
        this.workerId = workerId;
        this.context = context;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void run() {
        Frontier frontier = context.frontier();
        CrawlCounters counters = context.counters();
        try {
            while (!context.isStopRequested()) {
                state = WorkerState.IDLE;
                if (!counters.tryReservePage()) {
                    log.debug("Worker {} stopping: page budget of {} reserved", workerId, counters.maxPages());
                    break;
                }
                state = WorkerState.POPPING;
                FrontierItem item;
                try {
                    item = frontier.pop(context.pollTimeout());
                } catch (InterruptedException e) {
                    counters.releasePage();
                    Thread.currentThread().interrupt();
                    break;
                }
                if (item == null) {
                    counters.releasePage();
                    if (frontier.isDrained()) {
                        log.debug("Worker {} stopping: frontier drained", workerId);
                        break;
                    }
                    continue;
                }
                try {
                    process(item);
                } finally {
                    frontier.complete(item);
                }
            }
        } finally {
            state = WorkerState.STOPPED;
        }
    }

    void process(FrontierItem item) {
        PageResult result;
        try {
            result = crawl(item);
        } catch (RuntimeException e) {
            log.warn("Worker {} failed on {}", workerId, item.url(), e);
            result = PageResult.fetchError(
                item,
                null,
                clock.instant(),
                ReasonCodeClassifier.describe(ReasonCodeClassifier.UNKNOWN, e.getClass().getSimpleName() + ": " + e.getMessage())
            );
        }

        state = WorkerState.RECORDING;
        try {
            store.record(context.crawlRunId(), result);
        } catch (StoreWriteException e) {
            context.counters().recordStoreError();
            log.warn("Worker {} could not store result for {}", workerId, item.url(), e);
        }
        context.counters().recordProcessed(item.url(), item.depth(), result.status().isError());
        pagesHandled++;

        if (result.status().isError()) {
            log.warn("{} {} (depth {}): {}", result.status(), item.url(), item.depth(), result.errorMessage());
        } else {
            log.debug("{} {} (depth {}, {} links)", result.status(), item.url(), item.depth(), result.links().size());
        }
    }

    private PageResult crawl(FrontierItem item) {
        state = WorkerState.FETCHING;
        FetchOutcome outcome = fetchWithRetry(item.url());
        if (!outcome.isSuccess()) {
            return PageResult.fetchError(item, outcome.statusCodeOrNull(), fetchedAt(outcome), outcome.errorMessage());
        }
        if (!LinkExtractor.isHtml(outcome.contentType())) {
            if (LinkExtractor.isText(outcome.contentType())) {
                return PageResult.success(item, outcome.statusCode(), fetchedAt(outcome), new ArrayList<>(), outcome.body());
            }
            return PageResult.skipped(
                item,
                outcome.statusCode(),
                fetchedAt(outcome),
                ReasonCodeClassifier.describe(ReasonCodeClassifier.UNSUPPORTED_CONTENT, outcome.contentType())
            );
        }

        state = WorkerState.EXTRACTING;
        ExtractedLinks extracted;
        try {
            extracted = extractor.extract(outcome.body(), outcome.finalUrl());
        } catch (HtmlParseException e) {
            return PageResult.parseError(
                item,
                outcome.statusCode(),
                fetchedAt(outcome),
                ReasonCodeClassifier.describe(ReasonCodeClassifier.PARSING_FAILED, e.getMessage())
            );
        }

        state = WorkerState.PUSHING;
        Set<String> links = new LinkedHashSet<>();
        int pushed = 0;
        for (String href : extracted.hrefs()) {
            String normalized = UrlNormalizer.normalize(href, extracted.baseUrl());
            if (normalized == null || !links.add(normalized)) {
                continue;
            }
            if (context.scope().isInScope(normalized)
                && context.frontier().tryPush(normalized, item.depth() + 1)) {
                pushed++;
            }
        }
        log.debug("Worker {} pushed {} of {} links from {}", workerId, pushed, links.size(), item.url());
        return PageResult.success(item, outcome.statusCode(), fetchedAt(outcome), new ArrayList<>(links), outcome.body());
    }

    private FetchOutcome fetchWithRetry(String url) {
        int attempt = 1;
        FetchOutcome outcome = fetcher.fetch(url);
        while (context.retryPolicy().shouldRetry(outcome, attempt) && !context.isStopRequested()) {
            long backoffMs = context.retryPolicy().backoffMillis(attempt);
            if (backoffMs > 0) {
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            attempt++;
            log.debug("Retrying {} (attempt {}) after {}", url, attempt, outcome.errorMessage());
            outcome = fetcher.fetch(url);
        }
        return outcome;
    }

    private Instant fetchedAt(FetchOutcome outcome) {
        return outcome.fetchedAt() == null ? clock.instant() : outcome.fetchedAt();
    }

    public int workerId() {
        return workerId;
    }

    public WorkerState state() {
        return state;
    }

    public int pagesHandled() {
        return pagesHandled;
    }
}
