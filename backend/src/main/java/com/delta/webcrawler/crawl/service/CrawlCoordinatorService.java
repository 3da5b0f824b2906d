package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.extract.LinkExtractor;
import com.delta.webcrawler.crawl.frontier.CrawlScope;
import com.delta.webcrawler.crawl.frontier.Frontier;
import com.delta.webcrawler.crawl.http.FetchRetryPolicy;
import com.delta.webcrawler.crawl.http.PageFetcher;
import com.delta.webcrawler.crawl.model.CrawlReport;
import com.delta.webcrawler.crawl.model.CrawlRequest;
import com.delta.webcrawler.crawl.model.CrawlRunStatus;
import com.delta.webcrawler.crawl.persistence.CrawlJdbcRepository;
import com.delta.webcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
public class CrawlCoordinatorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlCoordinatorService.class);

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final LinkExtractor extractor;
    private final ResultStore store;
    private final CrawlJdbcRepository repository;
    private final Clock clock;

    public CrawlCoordinatorService(
        CrawlerProperties properties,
        PageFetcher fetcher,
        LinkExtractor extractor,
        ResultStore store,
        CrawlJdbcRepository repository,
        Clock clock
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.store = store;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Runs one crawl to completion and returns its report.
     *
     * @throws InvalidSeedUrlException when the base URL is not an absolute http(s) URL; no
     *     run is recorded and no worker is started
     */
    public CrawlReport run(CrawlRequest request) {
        String seed = UrlNormalizer.normalize(request.baseUrl());
        if (seed == null) {
            throw new InvalidSeedUrlException(request.baseUrl());
        }
        CrawlScope scope = CrawlScope.forSeed(
            seed,
            request.domainPolicy(),
            properties.getScope().getSkippedExtensions()
        );

        Instant startedAt = clock.instant();
        long crawlRunId = repository.insertCrawlRun(request, seed, startedAt);
        log.info(
            "Crawl run {} started: seed={} maxDepth={} maxPages={} workers={} policy={}",
            crawlRunId,
            seed,
            request.maxDepth(),
            request.maxPages(),
            request.numWorkers(),
            scope.policy()
        );

        Frontier frontier = new Frontier(request.maxDepth());
        CrawlCounters counters = new CrawlCounters(request.maxPages());
        CrawlRunContext context = new CrawlRunContext(
            crawlRunId,
            frontier,
            scope,
            counters,
            FetchRetryPolicy.from(properties),
            Duration.ofMillis(properties.getFrontier().getPollTimeoutMs())
        );
        frontier.seed(seed);

        WorkerPool pool = new WorkerPool(
            context,
            request.numWorkers(),
            workerId -> new CrawlWorker(workerId, context, fetcher, extractor, store, clock)
        );

        CrawlRunStatus status = CrawlRunStatus.FAILED;
        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "crawl-" + crawlRunId + "-monitor");
            thread.setDaemon(true);
            return thread;
        });
        try {
            int intervalSeconds = properties.getRun().getProgressIntervalSeconds();
            monitor.scheduleAtFixedRate(
                () -> reportProgress(crawlRunId, context),
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
            );
            int maxDurationSeconds = properties.getRun().getMaxDurationSeconds();
            if (maxDurationSeconds > 0) {
                monitor.schedule(
                    () -> {
                        log.info("Crawl run {} reached max duration of {}s, stopping workers", crawlRunId, maxDurationSeconds);
                        pool.requestStop();
                    },
                    maxDurationSeconds,
                    TimeUnit.SECONDS
                );
            }

            pool.start();
            pool.awaitTermination();
            status = pool.isStopRequested() ? CrawlRunStatus.STOPPED : CrawlRunStatus.COMPLETED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.requestStop();
            status = CrawlRunStatus.STOPPED;
            log.warn("Crawl run {} interrupted", crawlRunId);
        } catch (RuntimeException e) {
            pool.requestStop();
            log.warn("Crawl run {} failed", crawlRunId, e);
        } finally {
            monitor.shutdownNow();
        }

        Instant finishedAt = clock.instant();
        int maxDepthReached = Math.max(0, counters.maxDepthSeen());
        try {
            repository.completeCrawlRun(
                crawlRunId,
                finishedAt,
                status,
                counters.pagesProcessed(),
                counters.errorCount(),
                maxDepthReached
            );
        } catch (RuntimeException e) {
            log.warn("Unable to mark crawl run {} as {}", crawlRunId, status, e);
        }
        verifyStoredPages(crawlRunId, counters);

        CrawlReport report = new CrawlReport(
            crawlRunId,
            status,
            seed,
            maxDepthReached,
            counters.pagesProcessed(),
            counters.errorCount(),
            durationSeconds(startedAt, finishedAt),
            counters.processedUrls()
        );
        log.info(
            "Crawl run {} {}: pages={} errors={} maxDepth={} duration={}s",
            crawlRunId,
            status,
            report.pagesCrawled(),
            report.errorCount(),
            report.maxDepthReached(),
            report.durationSeconds()
        );
        return report;
    }

    private void reportProgress(long crawlRunId, CrawlRunContext context) {
        CrawlCounters counters = context.counters();
        log.info(
            "Crawl run {} progress: pages={}/{} errors={} visited={} pending={} inFlight={}",
            crawlRunId,
            counters.pagesProcessed(),
            counters.maxPages(),
            counters.errorCount(),
            context.frontier().visitedCount(),
            context.frontier().pendingCount(),
            context.frontier().inFlightCount()
        );
        try {
            repository.updateCrawlRunProgress(crawlRunId, counters.pagesProcessed(), counters.errorCount(), clock.instant());
        } catch (RuntimeException e) {
            log.debug("Progress update failed for crawl run {}", crawlRunId, e);
        }
    }

    private void verifyStoredPages(long crawlRunId, CrawlCounters counters) {
        int expected = counters.pagesProcessed() - counters.storeErrorCount();
        try {
            int stored = store.countAll(crawlRunId);
            if (stored != expected) {
                log.warn("Crawl run {} stored {} pages, expected {}", crawlRunId, stored, expected);
            }
        } catch (RuntimeException e) {
            log.warn("Unable to verify stored pages for crawl run {}", crawlRunId, e);
        }
        if (counters.storeErrorCount() > 0) {
            log.warn("Crawl run {} lost {} page records to store failures", crawlRunId, counters.storeErrorCount());
        }
    }

    static double durationSeconds(Instant startedAt, Instant finishedAt) {
        long millis = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
        return Math.round(millis / 10.0) / 100.0;
    }
}
