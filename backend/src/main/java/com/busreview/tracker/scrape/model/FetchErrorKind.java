package com.busreview.tracker.scrape.model;

public enum FetchErrorKind {
    TRANSIENT,
    TERMINAL
}
