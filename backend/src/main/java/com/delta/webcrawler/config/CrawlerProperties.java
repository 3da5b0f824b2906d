package com.delta.webcrawler.config;

import com.delta.webcrawler.crawl.frontier.DomainPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "web-crawler/1.0 (+contact)";
    private static final long DEFAULT_MAX_BODY_BYTES = 5L * 1024 * 1024;

    private String userAgent;
    private int requestTimeoutSeconds = 10;
    private long maxBodyBytes = DEFAULT_MAX_BODY_BYTES;
    private int perHostDelayMs = 0;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private Frontier frontier = new Frontier();
    private Scope scope = new Scope();
    private Run run = new Run();
    private Defaults defaults = new Defaults();
    private Cli cli = new Cli();
    private Report report = new Report();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public long getMaxBodyBytes() {
        return maxBodyBytes <= 0 ? DEFAULT_MAX_BODY_BYTES : maxBodyBytes;
    }

    public void setMaxBodyBytes(long maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Frontier getFrontier() {
        return frontier;
    }

    public void setFrontier(Frontier frontier) {
        this.frontier = frontier;
    }

    public Scope getScope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Frontier {
        private int pollTimeoutMs = 500;

        public int getPollTimeoutMs() {
            return Math.max(1, pollTimeoutMs);
        }

        public void setPollTimeoutMs(int pollTimeoutMs) {
            this.pollTimeoutMs = Math.max(1, pollTimeoutMs);
        }
    }

    public static class Scope {
        private DomainPolicy domainPolicy = DomainPolicy.SAME_HOST;
        private List<String> skippedExtensions = new ArrayList<>(List.of(
            "pdf", "jpg", "jpeg", "png", "gif", "svg", "ico", "webp",
            "zip", "gz", "tar", "mp3", "mp4", "avi", "mov", "exe", "dmg"
        ));

        public DomainPolicy getDomainPolicy() {
            return domainPolicy == null ? DomainPolicy.SAME_HOST : domainPolicy;
        }

        public void setDomainPolicy(DomainPolicy domainPolicy) {
            this.domainPolicy = domainPolicy;
        }

        public List<String> getSkippedExtensions() {
            return skippedExtensions == null ? List.of() : skippedExtensions;
        }

        public void setSkippedExtensions(List<String> skippedExtensions) {
            this.skippedExtensions = skippedExtensions;
        }
    }

    public static class Run {
        private int maxDurationSeconds = 0;
        private int progressIntervalSeconds = 5;

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }

        public int getProgressIntervalSeconds() {
            return Math.max(1, progressIntervalSeconds);
        }

        public void setProgressIntervalSeconds(int progressIntervalSeconds) {
            this.progressIntervalSeconds = Math.max(1, progressIntervalSeconds);
        }
    }

    public static class Defaults {
        private int maxDepth = 3;
        private int maxPages = 100;
        private int numThreads = 5;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getNumThreads() {
            return Math.max(1, numThreads);
        }

        public void setNumThreads(int numThreads) {
            this.numThreads = Math.max(1, numThreads);
        }
    }

    public static class Cli {
        private boolean enabled = true;
        private boolean exitAfterRun = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Report {
        private boolean pretty = true;

        public boolean isPretty() {
            return pretty;
        }

        public void setPretty(boolean pretty) {
            this.pretty = pretty;
        }
    }
}
