package com.delta.webcrawler.crawl.extract;

public class HtmlParseException extends Exception {
    public HtmlParseException(String message) {
        super(message);
    }

    public HtmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
