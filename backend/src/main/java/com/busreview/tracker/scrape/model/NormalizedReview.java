package com.busreview.tracker.scrape.model;

import com.busreview.tracker.scrape.sentiment.SentimentScore;

import java.time.LocalDate;
import java.util.Set;

public record NormalizedReview(
    String busId,
    String reviewId,
    String textHash,
    Double rating,
    String title,
    String text,
    LocalDate reviewDate,
    int reviewLength,
    int wordCount,
    SentimentScore sentiment,
    Set<QualityIssue> qualityIssues
) {
    public NormalizedReview withSentiment(SentimentScore score) {
        return new NormalizedReview(
            busId,
            reviewId,
            textHash,
            rating,
            title,
            text,
            reviewDate,
            reviewLength,
            wordCount,
            score,
            qualityIssues
        );
    }
}
