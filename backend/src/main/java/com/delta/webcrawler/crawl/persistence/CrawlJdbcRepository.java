package com.delta.webcrawler.crawl.persistence;

import com.delta.webcrawler.crawl.model.CrawlRequest;
import com.delta.webcrawler.crawl.model.CrawlRunStatus;
import com.delta.webcrawler.crawl.model.PageResult;
import com.delta.webcrawler.crawl.model.PageStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertCrawlRun(CrawlRequest request, String baseUrl, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("baseUrl", baseUrl)
            .addValue("status", CrawlRunStatus.RUNNING.name())
            .addValue("maxDepth", request.maxDepth())
            .addValue("maxPages", request.maxPages())
            .addValue("numWorkers", request.numWorkers())
            .addValue("startedAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (
                    base_url,
                    status,
                    max_depth,
                    max_pages,
                    num_workers,
                    started_at,
                    last_progress_at
                )
                VALUES (
                    :baseUrl,
                    :status,
                    :maxDepth,
                    :maxPages,
                    :numWorkers,
                    :startedAt,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("crawl_runs insert returned no id");
        }
        return key.longValue();
    }

    public void updateCrawlRunProgress(long crawlRunId, int pagesCrawled, int errorCount, Instant at) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", crawlRunId)
            .addValue("pagesCrawled", pagesCrawled)
            .addValue("errorCount", errorCount)
            .addValue("at", toTimestamp(at));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET pages_crawled = :pagesCrawled,
                    error_count = :errorCount,
                    last_progress_at = :at
                WHERE id = :id
                """,
            params
        );
    }

    public void completeCrawlRun(
        long crawlRunId,
        Instant finishedAt,
        CrawlRunStatus status,
        int pagesCrawled,
        int errorCount,
        Integer maxDepthReached
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", crawlRunId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status.name())
            .addValue("pagesCrawled", pagesCrawled)
            .addValue("errorCount", errorCount)
            .addValue("maxDepthReached", maxDepthReached);
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    pages_crawled = :pagesCrawled,
                    error_count = :errorCount,
                    max_depth_reached = :maxDepthReached,
                    last_progress_at = :finishedAt
                WHERE id = :id
                """,
            params
        );
    }

    public void insertPage(long crawlRunId, PageResult page) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("url", page.url())
            .addValue("depth", page.depth())
            .addValue("status", page.status().name())
            .addValue("httpStatus", page.httpStatusCode())
            .addValue("errorMessage", page.errorMessage())
            .addValue("fetchedAt", toTimestamp(page.fetchedAt()))
            .addValue("linksJson", toJson(page.links()))
            .addValue("content", page.content());
        jdbc.update(
            """
                INSERT INTO pages (
                    crawl_run_id,
                    url,
                    depth,
                    status,
                    http_status,
                    error_message,
                    fetched_at,
                    links_json,
                    content
                )
                VALUES (
                    :crawlRunId,
                    :url,
                    :depth,
                    :status,
                    :httpStatus,
                    :errorMessage,
                    :fetchedAt,
                    :linksJson,
                    :content
                )
                """,
            params
        );
    }

    public List<PageResult> findPagesForRun(long crawlRunId) {
        return jdbc.query(
            """
                SELECT url,
                       depth,
                       status,
                       http_status,
                       error_message,
                       fetched_at,
                       links_json,
                       content
                FROM pages
                WHERE crawl_run_id = :crawlRunId
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("crawlRunId", crawlRunId),
            pageRowMapper()
        );
    }

    public int countPagesForRun(long crawlRunId) {
        Integer value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM pages
                WHERE crawl_run_id = :crawlRunId
                """,
            new MapSqlParameterSource().addValue("crawlRunId", crawlRunId),
            Integer.class
        );
        return value == null ? 0 : value;
    }

    private RowMapper<PageResult> pageRowMapper() {
        return (rs, rowNum) -> new PageResult(
            rs.getString("url"),
            rs.getInt("depth"),
            PageStatus.valueOf(rs.getString("status")),
            nullableInt(rs, "http_status"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("fetched_at")),
            fromJson(rs.getString("links_json")),
            rs.getString("content")
        );
    }

    private String toJson(List<String> links) {
        if (links == null || links.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize {} extracted links", links.size(), e);
            return "[]";
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unable to read links_json column", e);
            return List.of();
        }
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
