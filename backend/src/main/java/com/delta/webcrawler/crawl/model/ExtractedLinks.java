package com.delta.webcrawler.crawl.model;

import java.util.List;

/**
 * Raw anchor targets found in a document, in document order, with the URL they resolve against.
 */
public record ExtractedLinks(String baseUrl, List<String> hrefs) {
    public ExtractedLinks {
        hrefs = hrefs == null ? List.of() : List.copyOf(hrefs);
    }
}
