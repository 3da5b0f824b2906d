package com.delta.webcrawler.crawl.extract;

import com.delta.webcrawler.crawl.model.ExtractedLinks;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selects anchor targets from an HTML document. Tokenizing is left to jsoup; hrefs are
 * returned as written so that resolution and filtering stay in one place.
 */
@Component
public class LinkExtractor {

    /**
     * @param html    page body
     * @param pageUrl URL the body was served from
     * @return raw hrefs in document order, with {@code <base href>} applied to the base URL
     * @throws HtmlParseException when the body is not text
     */
    public ExtractedLinks extract(String html, String pageUrl) throws HtmlParseException {
        String baseUrl = pageUrl == null ? "" : pageUrl;
        if (html == null || html.isBlank()) {
            return new ExtractedLinks(baseUrl, List.of());
        }
        if (html.indexOf('\u0000') >= 0) {
            throw new HtmlParseException("Body contains binary data");
        }
        Document doc;
        try {
            doc = Jsoup.parse(html, baseUrl);
        } catch (RuntimeException e) {
            throw new HtmlParseException("Unable to parse HTML: " + e.getMessage(), e);
        }
        String documentBase = doc.baseUri();
        if (documentBase == null || documentBase.isBlank()) {
            documentBase = baseUrl;
        }
        List<String> hrefs = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (!href.isEmpty()) {
                hrefs.add(href);
            }
        }
        return new ExtractedLinks(documentBase, hrefs);
    }

    /**
     * HTML bodies are parsed for links. A missing content type is treated as HTML.
     */
    public static boolean isHtml(String contentType) {
        String type = mediaType(contentType);
        return type.isEmpty() || type.equals("text/html") || type.equals("application/xhtml+xml");
    }

    public static boolean isText(String contentType) {
        String type = mediaType(contentType);
        return type.startsWith("text/")
            || type.endsWith("+xml")
            || type.equals("application/xml")
            || type.equals("application/json");
    }

    private static String mediaType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String type = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
