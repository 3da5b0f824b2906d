package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.crawl.model.PageResult;
import com.delta.webcrawler.crawl.persistence.CrawlJdbcRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Append-only store of page outcomes. Writes from concurrent workers are serialized;
 * a failed write is reported to the caller and never retried here.
 */
@Service
public class ResultStore {
    private final CrawlJdbcRepository repository;
    private final Object writeLock = new Object();

    public ResultStore(CrawlJdbcRepository repository) {
        this.repository = repository;
    }

    public void record(long crawlRunId, PageResult page) {
        synchronized (writeLock) {
            try {
                repository.insertPage(crawlRunId, page);
            } catch (DataAccessException e) {
                throw new StoreWriteException("Failed to record page " + page.url(), e);
            } catch (RuntimeException e) {
                throw new StoreWriteException("Unexpected error recording page " + page.url(), e);
            }
        }
    }

    /**
     * @return the run's page results in completion order
     */
    public List<PageResult> queryAll(long crawlRunId) {
        return repository.findPagesForRun(crawlRunId);
    }

    public int countAll(long crawlRunId) {
        return repository.countPagesForRun(crawlRunId);
    }
}
