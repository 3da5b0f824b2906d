package com.delta.webcrawler.crawl.frontier;

import com.delta.webcrawler.crawl.util.UrlNormalizer;

import java.net.URI;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which normalized links belong to a crawl by applying the domain policy and the
 * skipped-extension list. Stateless and safe to share across workers.
 */
public final class CrawlScope {
    private final String seedHost;
    private final int seedPort;
    private final String seedDomain;
    private final DomainPolicy policy;
    private final Set<String> skippedExtensions;

    private CrawlScope(String seedHost, int seedPort, DomainPolicy policy, Set<String> skippedExtensions) {
        this.seedHost = seedHost;
        this.seedPort = seedPort;
        this.seedDomain = seedHost.startsWith("www.") ? seedHost.substring(4) : seedHost;
        this.policy = policy == null ? DomainPolicy.SAME_HOST : policy;
        this.skippedExtensions = skippedExtensions;
    }

    /**
     * @param normalizedSeed seed URL, already normalized
     */
    public static CrawlScope forSeed(String normalizedSeed, DomainPolicy policy, Collection<String> skippedExtensions) {
        URI seed = UrlNormalizer.safeUri(normalizedSeed);
        if (seed == null || seed.getHost() == null) {
            throw new IllegalArgumentException("Seed is not an absolute URL: " + normalizedSeed);
        }
        Set<String> extensions = skippedExtensions == null
            ? Set.of()
            : skippedExtensions.stream()
                .filter(ext -> ext != null && !ext.isBlank())
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
        return new CrawlScope(seed.getHost().toLowerCase(Locale.ROOT), seed.getPort(), policy, extensions);
    }

    /**
     * @param normalizedUrl output of {@link UrlNormalizer#normalize(String, String)}
     */
    public boolean isInScope(String normalizedUrl) {
        URI uri = UrlNormalizer.safeUri(normalizedUrl);
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        return isInDomain(uri) && !hasSkippedExtension(uri);
    }

    public DomainPolicy policy() {
        return policy;
    }

    private boolean isInDomain(URI uri) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return switch (policy) {
            case ALL -> true;
            case SAME_HOST -> host.equals(seedHost) && uri.getPort() == seedPort;
            case SAME_DOMAIN -> host.equals(seedDomain) || host.endsWith("." + seedDomain);
        };
    }

    private boolean hasSkippedExtension(URI uri) {
        if (skippedExtensions.isEmpty()) {
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        int slash = path.lastIndexOf('/');
        String lastSegment = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return false;
        }
        return skippedExtensions.contains(lastSegment.substring(dot + 1));
    }
}
