package com.busreview.tracker.scrape.parse;

public class PageParseException extends RuntimeException {
    public enum Kind {
        MALFORMED_PAGE,
        MALFORMED_RECORD
    }

    private final Kind kind;

    public PageParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
