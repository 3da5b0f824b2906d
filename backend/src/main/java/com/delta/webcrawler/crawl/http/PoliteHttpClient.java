package com.delta.webcrawler.crawl.http;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.model.HttpFetchResult;
import com.delta.webcrawler.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin wrapper over the JDK {@link HttpClient}: one GET per call, no retries, no shared
 * mutable state apart from the optional per-host pacing. The request timeout bounds the whole
 * exchange, body included. Failures are returned as an {@link HttpFetchResult} with an
 * {@code errorCode} instead of being thrown.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_IO = "io_error";
    public static final String ERROR_INTERRUPTED = "interrupted";
    public static final String ERROR_INVALID_URL = "invalid_url";
    public static final String ERROR_BODY_TOO_LARGE = "body_too_large";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, properties.getMaxBodyBytes());
    }

    public HttpFetchResult get(String url, String acceptHeader, long maxBytes) {
        Instant startedAt = Instant.now();
        URI uri = UrlNormalizer.safeUri(url == null ? null : url.trim());
        if (uri == null || uri.getHost() == null || !UrlNormalizer.isHttpScheme(uri.getScheme())) {
            return errorResult(url, startedAt, 0, ERROR_INVALID_URL, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        long cap = maxBytes <= 0 ? properties.getMaxBodyBytes() : maxBytes;
        long timeoutMs = Duration.ofSeconds(properties.getRequestTimeoutSeconds()).toMillis();
        CompletableFuture<HttpResponse<CappedBodySubscriber.Body>> pending = null;
        try {
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(timeoutMs))
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            pending = client.sendAsync(request, CappedBodySubscriber.handler(cap));
            return toResult(url, startedAt, pending.get(timeoutMs, TimeUnit.MILLISECONDS), cap);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return errorResult(url, startedAt, 0, ERROR_TIMEOUT, "No complete response within " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            return failureResult(url, startedAt, e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            if (pending != null) {
                pending.cancel(true);
            }
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, 0, ERROR_INTERRUPTED, describe(e));
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, 0, ERROR_INVALID_URL, describe(e));
        }
    }

    private HttpFetchResult toResult(
        String url,
        Instant startedAt,
        HttpResponse<CappedBodySubscriber.Body> response,
        long cap
    ) {
        int statusCode = response.statusCode();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        CappedBodySubscriber.Body body = response.body();
        // error statuses keep their (capped) body and are classified by status, not size
        if (body.truncated() && statusCode >= 200 && statusCode < 300) {
            long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            String detail = declaredLength > cap
                ? "Content-Length " + declaredLength + " exceeds " + cap + " bytes"
                : "Body exceeds " + cap + " bytes";
            return errorResult(url, startedAt, statusCode, ERROR_BODY_TOO_LARGE, detail);
        }
        return HttpFetchResult.response(
            url,
            response.uri(),
            statusCode,
            contentType,
            new String(body.bytes(), charsetOf(contentType)),
            Instant.now()
        );
    }

    private HttpFetchResult failureResult(String url, Instant startedAt, Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return errorResult(url, startedAt, 0, ERROR_TIMEOUT, describe(cause));
        }
        if (cause instanceof IllegalArgumentException) {
            return errorResult(url, startedAt, 0, ERROR_INVALID_URL, describe(cause));
        }
        return errorResult(url, startedAt, 0, ERROR_IO, describe(cause));
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        int delayMs = properties.getPerHostDelayMs();
        if (delayMs <= 0) {
            return;
        }
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(delayMs));
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = e.getCause();
            message = cause == null ? null : cause.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, int statusCode, String code, String message) {
        log.debug("GET {} failed after {} ms: {} {}", url, Duration.between(startedAt, Instant.now()).toMillis(), code, message);
        return HttpFetchResult.failure(url, statusCode, code, message, Instant.now());
    }
}
