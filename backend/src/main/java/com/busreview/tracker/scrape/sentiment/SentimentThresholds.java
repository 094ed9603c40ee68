package com.busreview.tracker.scrape.sentiment;

public record SentimentThresholds(double positive, double negative) {
    public static final SentimentThresholds DEFAULT = new SentimentThresholds(0.05, -0.05);

    public SentimentThresholds {
        if (negative > positive) {
            throw new IllegalArgumentException(
                "Negative threshold " + negative + " must not exceed positive threshold " + positive
            );
        }
    }

    public SentimentLabel labelFor(double value) {
        if (value >= positive) {
            return SentimentLabel.POSITIVE;
        }
        if (value <= negative) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }

    public SentimentScore toScore(double value) {
        double bounded = Double.isNaN(value) ? 0.0 : Math.max(-1.0, Math.min(1.0, value));
        return new SentimentScore(labelFor(bounded), bounded);
    }
}
