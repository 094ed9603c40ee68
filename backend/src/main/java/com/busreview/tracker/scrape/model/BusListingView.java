package com.busreview.tracker.scrape.model;

import java.time.Instant;

public record BusListingView(
    String busId,
    String operatorName,
    String busName,
    String busType,
    String origin,
    String destination,
    String departureTime,
    Double avgRating,
    int ratingCount,
    Double sentimentPositive,
    Double sentimentNegative,
    String qualityIssues,
    Instant lastScrapedAt
) {}
