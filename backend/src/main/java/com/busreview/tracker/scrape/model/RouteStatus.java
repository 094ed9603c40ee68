package com.busreview.tracker.scrape.model;

public enum RouteStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED
}
