package com.delta.webcrawler.crawl.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Fixed set of {@link CrawlWorker}s for one run, each on its own thread.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final CrawlRunContext context;
    private final List<CrawlWorker> workers;
    private final ExecutorService executor;
    private final List<CompletableFuture<Void>> futures = new ArrayList<>();

    public WorkerPool(CrawlRunContext context, int size, IntFunction<CrawlWorker> workerFactory) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1");
        }
        this.context = context;
        List<CrawlWorker> created = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            created.add(workerFactory.apply(i));
        }
        this.workers = List.copyOf(created);
        this.executor = Executors.newFixedThreadPool(size, workerThreadFactory(context.crawlRunId()));
    }

    public synchronized void start() {
        if (!futures.isEmpty()) {
            throw new IllegalStateException("Worker pool already started");
        }
        for (CrawlWorker worker : workers) {
            futures.add(CompletableFuture.runAsync(worker, executor));
        }
    }

    /**
     * Blocks until every worker has left its loop, then releases the threads.
     */
    public void awaitTermination() throws InterruptedException {
        List<CompletableFuture<Void>> started;
        synchronized (this) {
            started = List.copyOf(futures);
        }
        try {
            for (int i = 0; i < started.size(); i++) {
                try {
                    started.get(i).join();
                } catch (CompletionException e) {
                    log.warn("Crawl worker {} terminated abnormally", workers.get(i).workerId(), e.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }
        for (CrawlWorker worker : workers) {
            log.debug("Crawl worker {} handled {} pages", worker.workerId(), worker.pagesHandled());
        }
        if (!allStopped()) {
            log.warn("Crawl run {} workers left their loop without stopping: {}", context.crawlRunId(), workerStates());
        }
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    /**
     * Asks every worker to stop at its next iteration and wakes workers waiting on the frontier.
     */
    public void requestStop() {
        context.stopRequested().set(true);
        context.frontier().close();
    }

    public boolean isStopRequested() {
        return context.isStopRequested();
    }

    public List<WorkerState> workerStates() {
        return workers.stream().map(CrawlWorker::state).toList();
    }

    public boolean allStopped() {
        return workers.stream().allMatch(worker -> worker.state() == WorkerState.STOPPED);
    }

    private static ThreadFactory workerThreadFactory(long crawlRunId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "crawl-" + crawlRunId + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
