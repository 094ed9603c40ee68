package com.busreview.tracker.scrape.sentiment;

/**
 * Maps normalized review text to a label and a value in [-1, 1].
 * Blank text scores {@link SentimentScore#NEUTRAL}; implementations never throw for any input.
 */
public interface SentimentScorer {
    SentimentScore score(String text);
}
