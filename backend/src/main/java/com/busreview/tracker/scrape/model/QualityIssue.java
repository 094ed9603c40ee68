package com.busreview.tracker.scrape.model;

public enum QualityIssue {
    RATING_INVALID,
    DATE_INVALID,
    UNMAPPED_BUS_TYPE
}
