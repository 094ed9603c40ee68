package com.busreview.tracker.scrape.sentiment;

/**
 * Base for backends that only produce a raw polarity; labelling follows the configured thresholds.
 */
public abstract class ThresholdSentimentScorer implements SentimentScorer {
    private final SentimentThresholds thresholds;

    protected ThresholdSentimentScorer(SentimentThresholds thresholds) {
        this.thresholds = thresholds == null ? SentimentThresholds.DEFAULT : thresholds;
    }

    @Override
    public final SentimentScore score(String text) {
        if (text == null || text.isBlank()) {
            return SentimentScore.NEUTRAL;
        }
        return thresholds.toScore(polarity(text));
    }

    protected abstract double polarity(String text);

    public SentimentThresholds thresholds() {
        return thresholds;
    }
}
