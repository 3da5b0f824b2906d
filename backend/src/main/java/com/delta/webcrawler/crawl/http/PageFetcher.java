package com.delta.webcrawler.crawl.http;

import com.delta.webcrawler.crawl.model.FetchFailureKind;
import com.delta.webcrawler.crawl.model.FetchOutcome;
import com.delta.webcrawler.crawl.model.HttpFetchResult;
import com.delta.webcrawler.crawl.util.ReasonCodeClassifier;
import org.springframework.stereotype.Component;

/**
 * Performs one GET for a crawl page and classifies the result. Never retries.
 */
@Component
public class PageFetcher {
    static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,text/*;q=0.8,*/*;q=0.5";

    private final PoliteHttpClient httpClient;

    public PageFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public FetchOutcome fetch(String url) {
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML);
        if (result.errorCode() != null) {
            FetchFailureKind kind = PoliteHttpClient.ERROR_BODY_TOO_LARGE.equals(result.errorCode())
                ? FetchFailureKind.TOO_LARGE
                : FetchFailureKind.NETWORK_ERROR;
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            return FetchOutcome.failed(
                url,
                result.statusCode(),
                kind,
                ReasonCodeClassifier.describe(reason, result.errorMessage()),
                result.fetchedAt()
            );
        }
        if (!result.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromHttpStatus(result.statusCode());
            return FetchOutcome.failed(
                url,
                result.statusCode(),
                FetchFailureKind.HTTP_ERROR,
                ReasonCodeClassifier.describe(reason, "HTTP " + result.statusCode()),
                result.fetchedAt()
            );
        }
        return FetchOutcome.ok(
            url,
            result.finalUrlOrRequested(),
            result.statusCode(),
            result.body(),
            result.contentType(),
            result.fetchedAt()
        );
    }
}
