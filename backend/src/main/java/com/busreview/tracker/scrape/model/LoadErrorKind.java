package com.busreview.tracker.scrape.model;

public enum LoadErrorKind {
    FOREIGN_KEY_VIOLATION,
    CONSTRAINT_VIOLATION
}
