package com.busreview.tracker.scrape.model;

public record FetchOutcome(RawPage page, FetchError error) {
    public static FetchOutcome success(RawPage page) {
        return new FetchOutcome(page, null);
    }

    public static FetchOutcome failure(FetchError error) {
        return new FetchOutcome(null, error);
    }

    public boolean isSuccess() {
        return page != null && error == null;
    }
}
