package com.delta.webcrawler.crawl.http;

import com.delta.webcrawler.crawl.model.FetchFailureKind;
import com.delta.webcrawler.crawl.model.FetchOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FetchRetryPolicyTest {

    private final FetchRetryPolicy policy = new FetchRetryPolicy(2, 100, 1000);

    @Test
    void retriesTransientFailuresUntilAttemptsAreUsed() {
        FetchOutcome timeout = failed(0, FetchFailureKind.NETWORK_ERROR, "TIMEOUT: HttpTimeoutException");

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.shouldRetry(timeout, 1)).isTrue();
        assertThat(policy.shouldRetry(timeout, 2)).isTrue();
        assertThat(policy.shouldRetry(timeout, 3)).isFalse();
    }

    @Test
    void retriesOnlyRetryableHttpStatuses() {
        assertThat(policy.shouldRetry(failed(503, FetchFailureKind.HTTP_ERROR, "HTTP_5XX: HTTP 503"), 1)).isTrue();
        assertThat(policy.shouldRetry(failed(429, FetchFailureKind.HTTP_ERROR, "HTTP_429_RATE_LIMIT: HTTP 429"), 1)).isTrue();
        assertThat(policy.shouldRetry(failed(408, FetchFailureKind.HTTP_ERROR, "TIMEOUT: HTTP 408"), 1)).isTrue();
        assertThat(policy.shouldRetry(failed(404, FetchFailureKind.HTTP_ERROR, "HTTP_404: HTTP 404"), 1)).isFalse();
    }

    @Test
    void neverRetriesSuccessInvalidUrlOrTooLarge() {
        FetchOutcome ok = FetchOutcome.ok("http://a/", "http://a/", 200, "", "text/html", Instant.now());

        assertThat(policy.shouldRetry(ok, 1)).isFalse();
        assertThat(policy.shouldRetry(failed(0, FetchFailureKind.NETWORK_ERROR, "INVALID_URL: bad"), 1)).isFalse();
        assertThat(policy.shouldRetry(failed(200, FetchFailureKind.TOO_LARGE, "BODY_TOO_LARGE: big"), 1)).isFalse();
    }

    @Test
    void backoffIsBoundedByMaxDelay() {
        for (int attempt = 1; attempt <= 10; attempt++) {
            long delay = policy.backoffMillis(attempt);
            assertThat(delay).isBetween(0L, 1000L);
        }
        assertThat(FetchRetryPolicy.none().backoffMillis(3)).isZero();
        assertThat(FetchRetryPolicy.none().maxAttempts()).isEqualTo(1);
    }

    private static FetchOutcome failed(int status, FetchFailureKind kind, String message) {
        return FetchOutcome.failed("http://example.com/", status, kind, message, Instant.now());
    }
}
