package com.delta.webcrawler.crawl.frontier;

import com.delta.webcrawler.crawl.model.FrontierItem;
import com.delta.webcrawler.crawl.util.UrlNormalizer;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue of pending {@link FrontierItem}s guarded together with the visited set.
 *
 * <p>A URL enters the visited set and the pending queue in one critical section, so it is
 * enqueued at most once over the lifetime of the crawl. The frontier also counts items that
 * have been popped but not yet {@linkplain #complete(FrontierItem) completed}: once nothing
 * is pending and nothing is in flight no more work can appear, and every {@link #pop} returns
 * {@code null} without waiting.
 */
public class Frontier {
    private final int maxDepth;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<FrontierItem> pending = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private int inFlight;
    private long popped;
    private boolean closed;

    public Frontier(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Enqueues the seed at depth 0. No-op when the URL does not normalize or was already seen.
     */
    public boolean seed(String rawUrl) {
        String normalized = UrlNormalizer.normalize(rawUrl);
        if (normalized == null) {
            return false;
        }
        return tryPush(normalized, 0);
    }

    /**
     * @param url   normalized URL
     * @param depth link distance from the seed
     * @return {@code true} when the item was enqueued, {@code false} when it was too deep,
     *     already visited or the frontier is closed
     */
    public boolean tryPush(String url, int depth) {
        if (url == null || url.isBlank() || depth < 0 || depth > maxDepth) {
            return false;
        }
        lock.lock();
        try {
            if (closed || !visited.add(url)) {
                return false;
            }
            pending.addLast(new FrontierItem(url, depth));
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the oldest pending item, waiting up to {@code timeout} while other workers may
     * still push. The caller must hand the item back through {@link #complete(FrontierItem)}.
     *
     * @return the next item, or {@code null} when the wait timed out or the frontier is drained
     */
    public FrontierItem pop(Duration timeout) throws InterruptedException {
        long remaining = timeout == null ? 0L : Math.max(0L, timeout.toNanos());
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() || closed) {
                if (isDrainedLocked() || remaining <= 0L) {
                    return null;
                }
                remaining = changed.awaitNanos(remaining);
            }
            FrontierItem item = pending.pollFirst();
            inFlight++;
            popped++;
            return item;
        } finally {
            lock.unlock();
        }
    }

    public void complete(FrontierItem item) {
        if (item == null) {
            return;
        }
        lock.lock();
        try {
            if (inFlight > 0) {
                inFlight--;
            }
            if (isDrainedLocked()) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops handing out work. Waiting and future pops return {@code null} immediately.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return isDrainedLocked();
        } finally {
            lock.unlock();
        }
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int visitedCount() {
        lock.lock();
        try {
            return visited.size();
        } finally {
            lock.unlock();
        }
    }

    public long poppedCount() {
        lock.lock();
        try {
            return popped;
        } finally {
            lock.unlock();
        }
    }

    private boolean isDrainedLocked() {
        return closed || (pending.isEmpty() && inFlight == 0);
    }
}
