package com.busreview.tracker.scrape.model;

public record LoadError(
    LoadErrorKind kind,
    String busId,
    String reviewId,
    String message
) {}
