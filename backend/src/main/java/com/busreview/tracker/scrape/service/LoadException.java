package com.busreview.tracker.scrape.service;

import com.busreview.tracker.scrape.model.LoadErrorKind;

public class LoadException extends RuntimeException {
    private final LoadErrorKind kind;
    private final String busId;

    public LoadException(LoadErrorKind kind, String busId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.busId = busId;
    }

    public LoadErrorKind getKind() {
        return kind;
    }

    public String getBusId() {
        return busId;
    }
}
