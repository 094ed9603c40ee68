package com.busreview.tracker.scrape.model;

public enum TerminalReason {
    END_OF_RESULTS,
    CHALLENGE
}
