package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.model.CrawlReport;
import com.delta.webcrawler.crawl.model.CrawlRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final CrawlerProperties properties;
    private final CrawlCoordinatorService coordinator;
    private final ReportWriter reportWriter;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlCoordinatorService coordinator,
        ReportWriter reportWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.coordinator = coordinator;
        this.reportWriter = reportWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isEnabled()) {
            return;
        }

        int exitCode = execute(args.getSourceArgs(), System.out, System.err);

        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(String[] args, PrintStream stdout, PrintStream stderr) {
        CrawlCommandLine commandLine;
        try {
            commandLine = CrawlCommandLine.parse(args, properties);
        } catch (CrawlUsageException e) {
            stderr.println("error: " + e.getMessage());
            stderr.println();
            stderr.print(CrawlCommandLine.usage(properties));
            return EXIT_USAGE;
        }
        if (commandLine.help()) {
            stdout.print(CrawlCommandLine.usage(properties));
            return EXIT_OK;
        }

        CrawlReport report;
        try {
            report = coordinator.run(commandLine.toRequest());
        } catch (InvalidSeedUrlException e) {
            log.error(e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Crawl of {} could not start", commandLine.baseUrl(), e);
            return EXIT_FAILURE;
        }

        try {
            reportWriter.write(report, commandLine.output(), stdout);
        } catch (IOException e) {
            log.error("Unable to write crawl report to {}", commandLine.output(), e);
            return EXIT_FAILURE;
        }
        return report.status() == CrawlRunStatus.FAILED ? EXIT_FAILURE : EXIT_OK;
    }
}
