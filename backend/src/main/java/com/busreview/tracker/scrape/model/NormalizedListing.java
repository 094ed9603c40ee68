package com.busreview.tracker.scrape.model;

import java.util.Set;

public record NormalizedListing(
    String busId,
    String listingRef,
    String operatorName,
    String busName,
    BusType busType,
    String origin,
    String destination,
    String departureTime,
    Double sourceRating,
    Integer sourceRatingCount,
    Set<QualityIssue> qualityIssues
) {}
