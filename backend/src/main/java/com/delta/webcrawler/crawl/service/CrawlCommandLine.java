package com.delta.webcrawler.crawl.service;

import com.delta.webcrawler.config.CrawlerProperties;
import com.delta.webcrawler.crawl.frontier.DomainPolicy;
import com.delta.webcrawler.crawl.model.CrawlRequest;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed {@code crawl <base_url> [options]} arguments. Options take their value either as the
 * next argument or after {@code =}. Spring property overrides ({@code --crawler.*},
 * {@code --spring.*}, {@code --logging.*}) are left to Spring and ignored here.
 */
public record CrawlCommandLine(
    String baseUrl,
    int maxDepth,
    int maxPages,
    int numThreads,
    Path output,
    DomainPolicy domainPolicy,
    boolean help
) {
    public static final String USAGE = """
        Usage: crawl <base_url> [options]

        Options:
          --max-depth N        maximum link depth from the seed (default %d)
          --max-pages N        maximum number of pages to fetch (default %d)
          --num-threads N      number of concurrent workers (default %d)
          --output PATH        write the JSON report to PATH instead of stdout
          --domain-policy P    SAME_HOST, SAME_DOMAIN or ALL (default %s)
          --help               print this message
        """;

    private static final List<String> SPRING_PREFIXES = List.of("--crawler.", "--spring.", "--logging.", "--server.", "--debug", "--trace");

    public static CrawlCommandLine parse(String[] args, CrawlerProperties properties) {
        CrawlerProperties.Defaults defaults = properties.getDefaults();
        int maxDepth = defaults.getMaxDepth();
        int maxPages = defaults.getMaxPages();
        int numThreads = defaults.getNumThreads();
        Path output = null;
        DomainPolicy policy = properties.getScope().getDomainPolicy();
        List<String> positional = new ArrayList<>();

        String[] safeArgs = args == null ? new String[0] : args;
        for (int i = 0; i < safeArgs.length; i++) {
            String arg = safeArgs[i];
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (arg.equals("--help") || arg.equals("-h")) {
                return new CrawlCommandLine(null, maxDepth, maxPages, numThreads, null, policy, true);
            }
            if (!arg.startsWith("--")) {
                positional.add(arg.trim());
                continue;
            }
            if (isSpringArgument(arg)) {
                continue;
            }

            String name = arg;
            String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            } else if (i + 1 < safeArgs.length) {
                value = safeArgs[++i];
            } else {
                throw new CrawlUsageException("Missing value for " + name);
            }

            switch (name) {
                case "--max-depth" -> maxDepth = parseInt(name, value, 0);
                case "--max-pages" -> maxPages = parseInt(name, value, 1);
                case "--num-threads" -> numThreads = parseInt(name, value, 1);
                case "--output" -> output = parsePath(value);
                case "--domain-policy" -> policy = parsePolicy(value);
                default -> throw new CrawlUsageException("Unknown option " + name);
            }
        }

        if (positional.size() == 2 && positional.get(0).equals("crawl")) {
            positional.remove(0);
        }
        if (positional.isEmpty()) {
            throw new CrawlUsageException("Missing base URL");
        }
        if (positional.size() > 1) {
            throw new CrawlUsageException("Unexpected arguments " + positional.subList(1, positional.size()));
        }
        return new CrawlCommandLine(positional.get(0), maxDepth, maxPages, numThreads, output, policy, false);
    }

    public static String usage(CrawlerProperties properties) {
        CrawlerProperties.Defaults defaults = properties.getDefaults();
        return USAGE.formatted(
            defaults.getMaxDepth(),
            defaults.getMaxPages(),
            defaults.getNumThreads(),
            properties.getScope().getDomainPolicy()
        );
    }

    public CrawlRequest toRequest() {
        return new CrawlRequest(baseUrl, maxDepth, maxPages, numThreads, domainPolicy);
    }

    private static boolean isSpringArgument(String arg) {
        for (String prefix : SPRING_PREFIXES) {
            if (arg.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static int parseInt(String name, String value, int min) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CrawlUsageException(name + " expects an integer, got '" + value + "'");
        }
        if (parsed < min) {
            throw new CrawlUsageException(name + " must be >= " + min);
        }
        return parsed;
    }

    private static Path parsePath(String value) {
        if (value == null || value.isBlank()) {
            throw new CrawlUsageException("--output expects a file path");
        }
        try {
            return Path.of(value.trim());
        } catch (InvalidPathException e) {
            throw new CrawlUsageException("Invalid --output path: " + e.getMessage());
        }
    }

    private static DomainPolicy parsePolicy(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return DomainPolicy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new CrawlUsageException("--domain-policy must be one of SAME_HOST, SAME_DOMAIN, ALL");
        }
    }
}
