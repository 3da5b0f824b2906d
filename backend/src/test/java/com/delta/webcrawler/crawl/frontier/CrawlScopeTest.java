package com.delta.webcrawler.crawl.frontier;

import com.delta.webcrawler.crawl.util.UrlNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlScopeTest {

    private static final List<String> EXTENSIONS = List.of("pdf", ".JPG", "png", "gif");

    @Test
    void sameHostAcceptsOnlySeedHostAndPort() {
        CrawlScope scope = CrawlScope.forSeed("http://example.com/", DomainPolicy.SAME_HOST, EXTENSIONS);

        assertThat(follow(scope, "/about")).isEqualTo("http://example.com/about");
        assertThat(follow(scope, "https://example.com/secure")).isEqualTo("https://example.com/secure");
        assertThat(follow(scope, "http://blog.example.com/")).isNull();
        assertThat(follow(scope, "http://example.com:8080/")).isNull();
        assertThat(follow(scope, "http://other.org/")).isNull();
    }

    @Test
    void sameDomainAcceptsSubdomainsAndIgnoresWwwOnSeed() {
        CrawlScope scope = CrawlScope.forSeed("http://www.example.com/", DomainPolicy.SAME_DOMAIN, List.of());

        assertThat(scope.isInScope("http://example.com/")).isTrue();
        assertThat(scope.isInScope("http://blog.example.com/post")).isTrue();
        assertThat(scope.isInScope("http://notexample.com/")).isFalse();
    }

    @Test
    void allPolicyFollowsEveryHttpLink() {
        CrawlScope scope = CrawlScope.forSeed("http://example.com/", DomainPolicy.ALL, List.of());

        assertThat(follow(scope, "https://other.org/page")).isEqualTo("https://other.org/page");
        assertThat(follow(scope, "mailto:a@b.c")).isNull();
    }

    @Test
    void rejectsBinaryExtensionsCaseInsensitively() {
        CrawlScope scope = CrawlScope.forSeed("http://example.com/", DomainPolicy.SAME_HOST, EXTENSIONS);

        assertThat(follow(scope, "/files/report.PDF")).isNull();
        assertThat(follow(scope, "/img/logo.jpg")).isNull();
        assertThat(follow(scope, "/page.html")).isEqualTo("http://example.com/page.html");
        assertThat(follow(scope, "/pdf/index")).isEqualTo("http://example.com/pdf/index");
        assertThat(follow(scope, "/download?file=a.pdf")).isEqualTo("http://example.com/download?file=a.pdf");
    }

    @Test
    void seedMustBeAbsolute() {
        assertThatThrownBy(() -> CrawlScope.forSeed("/relative", DomainPolicy.SAME_HOST, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullPolicyDefaultsToSameHost() {
        CrawlScope scope = CrawlScope.forSeed("http://example.com/", null, null);

        assertThat(scope.policy()).isEqualTo(DomainPolicy.SAME_HOST);
    }

    private static String follow(CrawlScope scope, String href) {
        String normalized = UrlNormalizer.normalize(href, "http://example.com/");
        return normalized != null && scope.isInScope(normalized) ? normalized : null;
    }
}
