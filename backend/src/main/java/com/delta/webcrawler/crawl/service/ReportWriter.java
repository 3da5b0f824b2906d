package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.model.CrawlReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    public ReportWriter(ObjectMapper objectMapper, CrawlerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String toJson(CrawlReport report) throws JsonProcessingException {
        ObjectWriter writer = properties.getReport().isPretty()
            ? objectMapper.writerWithDefaultPrettyPrinter()
            : objectMapper.writer();
        return writer.writeValueAsString(report);
    }

    /**
     * Writes the report to {@code output}, or to {@code stdout} when no path is given.
     */
    public void write(CrawlReport report, Path output, PrintStream stdout) throws IOException {
        String json = toJson(report);
        if (output == null) {
            stdout.println(json);
            stdout.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, json + System.lineSeparator(), StandardCharsets.UTF_8);
        log.info("Crawl report written to {}", output.toAbsolutePath());
    }
}
