package com.busreview.tracker.scrape.model;

import java.time.Instant;
import java.time.LocalDate;

public record ReviewView(
    String reviewId,
    String busId,
    Double rating,
    String reviewTitle,
    String reviewText,
    LocalDate reviewDate,
    String sentimentLabel,
    Double sentimentScore,
    String qualityIssues,
    Instant ingestedAt
) {}
