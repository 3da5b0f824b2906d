package com.delta.webcrawler.crawl.extract;

import com.delta.webcrawler.crawl.model.ExtractedLinks;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinkExtractorTest {

    private final LinkExtractor extractor = new LinkExtractor();

    @Test
    void returnsAnchorHrefsInDocumentOrder() throws Exception {
        String html = """
            <html><body>
              <a href="/first">First</a>
              <a>no href</a>
              <a href="  second.html ">Second</a>
              <link href="/style.css" rel="stylesheet">
              <img src="/logo.png">
              <a href="">empty</a>
              <a href="https://other.org/third">Third</a>
            </body></html>
            """;

        ExtractedLinks links = extractor.extract(html, "http://example.com/docs/");

        assertThat(links.hrefs()).containsExactly("/first", "second.html", "https://other.org/third");
        assertThat(links.baseUrl()).isEqualTo("http://example.com/docs/");
    }

    @Test
    void baseHrefOverridesPageUrl() throws Exception {
        String html = """
            <html><head><base href="http://example.com/assets/"></head>
            <body><a href="page">Page</a></body></html>
            """;

        ExtractedLinks links = extractor.extract(html, "http://example.com/index.html");

        assertThat(links.baseUrl()).isEqualTo("http://example.com/assets/");
        assertThat(links.hrefs()).containsExactly("page");
    }

    @Test
    void toleratesBrokenMarkup() throws Exception {
        ExtractedLinks links = extractor.extract("<div><a href='/x'>x<p><a href=/y>y", "http://example.com/");

        assertThat(links.hrefs()).containsExactly("/x", "/y");
    }

    @Test
    void blankBodyHasNoLinks() throws Exception {
        assertThat(extractor.extract("   ", "http://example.com/").hrefs()).isEmpty();
        assertThat(extractor.extract(null, "http://example.com/").hrefs()).isEmpty();
    }

    @Test
    void binaryBodyIsAParseError() {
        assertThatThrownBy(() -> extractor.extract("GIF89a\u0000\u0001", "http://example.com/"))
            .isInstanceOf(HtmlParseException.class);
    }

    @Test
    void classifiesContentTypes() {
        assertThat(LinkExtractor.isHtml("text/html; charset=UTF-8")).isTrue();
        assertThat(LinkExtractor.isHtml("application/xhtml+xml")).isTrue();
        assertThat(LinkExtractor.isHtml(null)).isTrue();
        assertThat(LinkExtractor.isHtml("image/png")).isFalse();
        assertThat(LinkExtractor.isText("text/plain")).isTrue();
        assertThat(LinkExtractor.isText("application/pdf")).isFalse();
    }
}
