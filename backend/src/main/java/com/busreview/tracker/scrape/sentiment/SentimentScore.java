package com.busreview.tracker.scrape.sentiment;

public record SentimentScore(SentimentLabel label, double value) {
    public static final SentimentScore NEUTRAL = new SentimentScore(SentimentLabel.NEUTRAL, 0.0);

    public SentimentScore {
        if (label == null) {
            throw new IllegalArgumentException("Sentiment label is required");
        }
        if (Double.isNaN(value)) {
            value = 0.0;
        }
        value = Math.max(-1.0, Math.min(1.0, value));
    }
}
