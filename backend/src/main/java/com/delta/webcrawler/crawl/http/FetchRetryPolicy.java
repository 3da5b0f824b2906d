package com.delta.webcrawler.crawl.http;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.model.FetchFailureKind;
import com.delta.webcrawler.crawl.model.FetchOutcome;
import com.delta.webcrawler.crawl.util.ReasonCodeClassifier;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Caller-side retry decision for page fetches: transient network failures and
 * 408/429/5xx answers are retried with exponential backoff and jitter.
 */
public final class FetchRetryPolicy {
    private final int maxRetries;
    private final int baseDelayMs;
    private final int maxDelayMs;

    public FetchRetryPolicy(int maxRetries, int baseDelayMs, int maxDelayMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
    }

    public static FetchRetryPolicy from(CrawlerProperties properties) {
        return new FetchRetryPolicy(
            properties.getRequestMaxRetries(),
            properties.getRequestRetryBaseDelayMs(),
            properties.getRequestRetryMaxDelayMs()
        );
    }

    public static FetchRetryPolicy none() {
        return new FetchRetryPolicy(0, 0, 0);
    }

    public int maxAttempts() {
        return 1 + maxRetries;
    }

    /**
     * @param attempt number of attempts already made, starting at 1
     */
    public boolean shouldRetry(FetchOutcome outcome, int attempt) {
        if (outcome == null || outcome.isSuccess() || attempt >= maxAttempts()) {
            return false;
        }
        if (outcome.failureKind() == FetchFailureKind.NETWORK_ERROR) {
            String message = outcome.errorMessage() == null ? "" : outcome.errorMessage();
            return !message.startsWith(ReasonCodeClassifier.INVALID_URL)
                && !message.startsWith(ReasonCodeClassifier.INTERRUPTED);
        }
        if (outcome.failureKind() == FetchFailureKind.HTTP_ERROR) {
            int status = outcome.statusCode();
            return status == 408 || status == 429 || status >= 500;
        }
        return false;
    }

    public long backoffMillis(int attempt) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return 0L;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }
}
