package com.delta.webcrawler.crawl.util;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonicalizes link strings so that equal pages compare equal in the frontier's visited set.
 *
 * <p>Relative references are resolved against the page they were found on, fragments are
 * dropped, scheme and host are lower-cased, default ports are removed and trailing slashes
 * are trimmed (an empty path becomes {@code /}). Anything that is not an absolute
 * {@code http}/{@code https} URL with a host is rejected with {@code null}.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        return normalize(url, null);
    }

    /**
     * @param rawLink   link as written in the page (absolute or relative)
     * @param sourceUrl page the link was found on, used for relative resolution (nullable)
     * @return canonical absolute URL, or {@code null} when the link is rejected
     */
    public static String normalize(String rawLink, String sourceUrl) {
        if (rawLink == null) {
            return null;
        }
        String candidate = rawLink.trim();
        if (candidate.isEmpty() || candidate.startsWith("#")) {
            return null;
        }
        String encoded = candidate.replace(" ", "%20");
        URI reference = safeUri(encoded);
        if (reference == null) {
            return null;
        }
        URI resolved = reference;
        if (!reference.isAbsolute()) {
            URI baseUri = baseUri(sourceUrl);
            if (baseUri == null) {
                return null;
            }
            // RFC 3986 resolution; URI.resolve drops the last path segment for query-only references
            String absolute = StringUtil.resolve(baseUri.toString(), encoded);
            if (absolute == null || absolute.isEmpty()) {
                return null;
            }
            resolved = safeUri(absolute);
            if (resolved == null || !resolved.isAbsolute()) {
                return null;
            }
        }
        return canonicalize(resolved);
    }

    public static boolean isHttpScheme(String scheme) {
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    // Trailing slashes of the source page matter for relative resolution, so the base is not canonicalized.
    private static URI baseUri(String sourceUrl) {
        URI base = safeUri(sourceUrl == null ? null : sourceUrl.trim());
        if (base == null || !base.isAbsolute() || base.isOpaque() || base.getRawAuthority() == null) {
            return null;
        }
        if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
            String rebuilt = base.getScheme() + "://" + base.getRawAuthority() + "/"
                + (base.getRawQuery() == null ? "" : "?" + base.getRawQuery());
            return safeUri(rebuilt);
        }
        return base;
    }

    private static String canonicalize(URI uri) {
        if (!isHttpScheme(uri.getScheme()) || uri.isOpaque()) {
            return null;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return null;
        }
        URI cleaned = uri.normalize();
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (cleaned.getRawUserInfo() != null) {
            sb.append(cleaned.getRawUserInfo()).append('@');
        }
        sb.append(host.toLowerCase(Locale.ROOT));
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(trimTrailingSlashes(cleaned.getRawPath()));
        String query = cleaned.getRawQuery();
        if (query != null && !query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    private static String trimTrailingSlashes(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
    }
}
