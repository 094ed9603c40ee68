package com.busreview.tracker.scrape.model;

public record ListingRecord(
    String listingRef,
    String operatorName,
    String busName,
    String busTypeText,
    String routeText,
    String departureText,
    String sourceRatingText,
    String sourceRatingCountText
) {}
