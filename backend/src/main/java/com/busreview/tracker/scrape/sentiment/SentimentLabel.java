package com.busreview.tracker.scrape.sentiment;

import java.util.Locale;

public enum SentimentLabel {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
