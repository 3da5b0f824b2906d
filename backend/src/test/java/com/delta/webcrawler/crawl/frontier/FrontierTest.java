package com.delta.webcrawler.crawl.frontier;

import com.delta.webcrawler.crawl.model.FrontierItem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FrontierTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    @Test
    void seedNormalizesAndIgnoresDuplicates() throws Exception {
        Frontier frontier = new Frontier(2);

        assertThat(frontier.seed("HTTP://Example.com/#top")).isTrue();
        assertThat(frontier.seed("http://example.com")).isFalse();
        assertThat(frontier.seed("not a url")).isFalse();

        FrontierItem item = frontier.pop(SHORT);
        assertThat(item).isEqualTo(new FrontierItem("http://example.com/", 0));
    }

    @Test
    void rejectsItemsDeeperThanMaxDepthAndAlreadyVisited() {
        Frontier frontier = new Frontier(1);

        assertThat(frontier.tryPush("http://example.com/a", 1)).isTrue();
        assertThat(frontier.tryPush("http://example.com/a", 1)).isFalse();
        assertThat(frontier.tryPush("http://example.com/b", 2)).isFalse();
        assertThat(frontier.visitedCount()).isEqualTo(1);
        assertThat(frontier.pendingCount()).isEqualTo(1);
    }

    @Test
    void popsInFifoOrder() throws Exception {
        Frontier frontier = new Frontier(3);
        frontier.tryPush("http://example.com/1", 0);
        frontier.tryPush("http://example.com/2", 1);
        frontier.tryPush("http://example.com/3", 1);

        assertThat(frontier.pop(SHORT).url()).isEqualTo("http://example.com/1");
        assertThat(frontier.pop(SHORT).url()).isEqualTo("http://example.com/2");
        assertThat(frontier.pop(SHORT).url()).isEqualTo("http://example.com/3");
    }

    @Test
    void completedUrlIsNeverEnqueuedAgain() throws Exception {
        Frontier frontier = new Frontier(3);
        frontier.seed("http://example.com/");
        FrontierItem item = frontier.pop(SHORT);
        frontier.complete(item);

        assertThat(frontier.tryPush("http://example.com/", 1)).isFalse();
        assertThat(frontier.isDrained()).isTrue();
    }

    @Test
    void popWaitsWhileAnotherWorkerIsInFlight() throws Exception {
        Frontier frontier = new Frontier(3);
        frontier.seed("http://example.com/");
        FrontierItem first = frontier.pop(SHORT);

        assertThat(frontier.isDrained()).isFalse();
        assertThat(frontier.pop(SHORT)).isNull();
        assertThat(frontier.isDrained()).isFalse();

        frontier.tryPush("http://example.com/child", 1);
        frontier.complete(first);
        FrontierItem child = frontier.pop(SHORT);
        assertThat(child.depth()).isEqualTo(1);
        frontier.complete(child);
        assertThat(frontier.isDrained()).isTrue();
    }

    @Test
    void blockedPopWakesWhenLastItemCompletes() throws Exception {
        Frontier frontier = new Frontier(1);
        frontier.seed("http://example.com/");
        FrontierItem item = frontier.pop(SHORT);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<FrontierItem> waiting = executor.submit(() -> frontier.pop(Duration.ofSeconds(30)));
            Thread.sleep(50);
            frontier.complete(item);

            assertThat(waiting.get(5, TimeUnit.SECONDS)).isNull();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void closeReleasesWaitingPopsAndRejectsPushes() throws Exception {
        Frontier frontier = new Frontier(1);
        frontier.seed("http://example.com/");
        frontier.pop(SHORT);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<FrontierItem> waiting = executor.submit(() -> frontier.pop(Duration.ofSeconds(30)));
            Thread.sleep(50);
            frontier.close();

            assertThat(waiting.get(5, TimeUnit.SECONDS)).isNull();
            assertThat(frontier.tryPush("http://example.com/late", 1)).isFalse();
            assertThat(frontier.isDrained()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentPushesOfSameUrlEnqueueItOnce() throws Exception {
        Frontier frontier = new Frontier(5);
        int threads = 8;
        int urls = 200;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < urls; i++) {
                        if (frontier.tryPush("http://example.com/p" + i, 1)) {
                            accepted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(urls);
        assertThat(frontier.pendingCount()).isEqualTo(urls);
        assertThat(frontier.visitedCount()).isEqualTo(urls);
    }
}
