package com.busreview.tracker.scrape.model;

public record ReviewRecord(
    String listingRef,
    String ratingText,
    String title,
    String body,
    String dateText
) {}
