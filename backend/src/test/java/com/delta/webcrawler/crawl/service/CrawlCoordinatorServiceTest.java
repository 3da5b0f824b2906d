package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.extract.LinkExtractor;
import com.delta.webcrawler.crawl.frontier.DomainPolicy;
import com.delta.webcrawler.crawl.http.PageFetcher;
import com.delta.webcrawler.crawl.model.CrawlReport;
import com.delta.webcrawler.crawl.model.CrawlRequest;
import com.delta.webcrawler.crawl.model.CrawlRunStatus;
import com.delta.webcrawler.crawl.model.FetchOutcome;
import com.delta.webcrawler.crawl.model.PageResult;
import com.delta.webcrawler.crawl.persistence.CrawlJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlCoordinatorServiceTest {

    @Mock
    private PageFetcher fetcher;
    @Mock
    private ResultStore store;
    @Mock
    private CrawlJdbcRepository repository;

    private CrawlerProperties properties;
    private CrawlCoordinatorService coordinator;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getFrontier().setPollTimeoutMs(20);
        coordinator = new CrawlCoordinatorService(
            properties,
            fetcher,
            new LinkExtractor(),
            store,
            repository,
            Clock.systemUTC()
        );
    }

    @Test
    void invalidSeedAbortsBeforeAnyWorkStarts() {
        assertThatThrownBy(() -> coordinator.run(new CrawlRequest("not-a-url", 3, 10, 2)))
            .isInstanceOf(InvalidSeedUrlException.class)
            .hasMessageContaining("not-a-url");
        assertThatThrownBy(() -> coordinator.run(new CrawlRequest("ftp://example.com/", 3, 10, 2)))
            .isInstanceOf(InvalidSeedUrlException.class);

        verifyNoInteractions(repository, fetcher, store);
    }

    @Test
    void depthZeroRunReportsSingleSeedPage() {
        when(repository.insertCrawlRun(any(CrawlRequest.class), anyString(), any(Instant.class))).thenReturn(42L);
        when(fetcher.fetch("http://example.com/")).thenReturn(FetchOutcome.ok(
            "http://example.com/",
            "http://example.com/",
            200,
            "<a href=\"/a\">a</a><a href=\"/b\">b</a>",
            "text/html",
            Instant.now()
        ));
        when(store.countAll(42L)).thenReturn(1);

        CrawlReport report = coordinator.run(new CrawlRequest("HTTP://Example.com", 0, 10, 3));

        assertThat(report.crawlRunId()).isEqualTo(42L);
        assertThat(report.status()).isEqualTo(CrawlRunStatus.COMPLETED);
        assertThat(report.baseUrl()).isEqualTo("http://example.com/");
        assertThat(report.pagesCrawled()).isEqualTo(1);
        assertThat(report.maxDepthReached()).isZero();
        assertThat(report.errorCount()).isZero();
        assertThat(report.visitedUrls()).containsExactly("http://example.com/");
        assertThat(report.durationSeconds()).isGreaterThanOrEqualTo(0.0);
        verify(store).record(eq(42L), any(PageResult.class));
        verify(repository).completeCrawlRun(eq(42L), any(Instant.class), eq(CrawlRunStatus.COMPLETED), eq(1), eq(0), eq(0));
    }

    @Test
    void maxDurationStopsAnEndlessCrawl() {
        properties.getRun().setMaxDurationSeconds(1);
        when(repository.insertCrawlRun(any(CrawlRequest.class), anyString(), any(Instant.class))).thenReturn(5L);
        when(fetcher.fetch(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            Thread.sleep(50);
            String prefix = url.endsWith("/") ? url : url + "/";
            String body = "<a href=\"" + prefix + "x\">x</a><a href=\"" + prefix + "y\">y</a>";
            return FetchOutcome.ok(url, url, 200, body, "text/html", Instant.now());
        });

        CrawlReport report = coordinator.run(
            new CrawlRequest("http://example.com/", 50, 100_000, 2, DomainPolicy.SAME_HOST));

        assertThat(report.status()).isEqualTo(CrawlRunStatus.STOPPED);
        assertThat(report.pagesCrawled()).isPositive().isLessThan(100_000);
        assertThat(report.durationSeconds()).isLessThan(30.0);
        verify(repository).completeCrawlRun(eq(5L), any(Instant.class), eq(CrawlRunStatus.STOPPED), anyInt(), anyInt(), any());
    }

    @Test
    void databaseFailureAtStartPropagates() {
        when(repository.insertCrawlRun(any(CrawlRequest.class), anyString(), any(Instant.class)))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> coordinator.run(new CrawlRequest("http://example.com/", 1, 10, 1)))
            .isInstanceOf(DataAccessException.class);
        verify(store, never()).record(anyLong(), any(PageResult.class));
    }

    @Test
    void durationIsRoundedToHundredths() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        assertThat(CrawlCoordinatorService.durationSeconds(start, start.plusMillis(1234))).isEqualTo(1.23);
        assertThat(CrawlCoordinatorService.durationSeconds(start, start.plusMillis(1236))).isEqualTo(1.24);
        assertThat(CrawlCoordinatorService.durationSeconds(start, start)).isZero();
    }
}
