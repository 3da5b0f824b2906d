package com.delta.webcrawler.crawl.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared progress of one crawl run, updated by every worker.
 *
 * <p>Page slots are reserved before a worker pops from the frontier and released if the pop
 * yields nothing, so {@code pagesProcessed <= reservedPages <= maxPages} always holds.
 */
public class CrawlCounters {
    private final int maxPages;
    private final AtomicInteger reservedPages = new AtomicInteger();
    private final AtomicInteger pagesProcessed = new AtomicInteger();
    private final AtomicInteger maxDepthSeen = new AtomicInteger(-1);
    private final AtomicInteger errorCount = new AtomicInteger();
    private final AtomicInteger storeErrorCount = new AtomicInteger();
    private final Queue<String> processedUrls = new ConcurrentLinkedQueue<>();

    public CrawlCounters(int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1");
        }
        this.maxPages = maxPages;
    }

    public boolean tryReservePage() {
        while (true) {
            int current = reservedPages.get();
            if (current >= maxPages) {
                return false;
            }
            if (reservedPages.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releasePage() {
        reservedPages.updateAndGet(current -> Math.max(0, current - 1));
    }

    public void recordProcessed(String url, int depth, boolean error) {
        processedUrls.add(url);
        maxDepthSeen.accumulateAndGet(depth, Math::max);
        if (error) {
            errorCount.incrementAndGet();
        }
        pagesProcessed.incrementAndGet();
    }

    public void recordStoreError() {
        storeErrorCount.incrementAndGet();
    }

    public boolean isBudgetExhausted() {
        return pagesProcessed.get() >= maxPages;
    }

    public int maxPages() {
        return maxPages;
    }

    public int pagesProcessed() {
        return pagesProcessed.get();
    }

    public int reservedPages() {
        return reservedPages.get();
    }

    /**
     * @return deepest processed depth, or {@code -1} before the first page completes
     */
    public int maxDepthSeen() {
        return maxDepthSeen.get();
    }

    public int errorCount() {
        return errorCount.get();
    }

    public int storeErrorCount() {
        return storeErrorCount.get();
    }

    public List<String> processedUrls() {
        return new ArrayList<>(processedUrls);
    }
}
