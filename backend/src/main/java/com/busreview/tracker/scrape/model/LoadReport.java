package com.busreview.tracker.scrape.model;

import java.util.ArrayList;
import java.util.List;

public record LoadReport(
    int listingsInserted,
    int listingsUpdated,
    int reviewsInserted,
    int reviewsDuplicateSkipped,
    int reviewsRejected,
    List<LoadError> errors
) {
    public static LoadReport empty() {
        return new LoadReport(0, 0, 0, 0, 0, List.of());
    }

    public LoadReport plus(LoadReport other) {
        if (other == null) {
            return this;
        }
        List<LoadError> merged = new ArrayList<>(errors);
        merged.addAll(other.errors());
        return new LoadReport(
            listingsInserted + other.listingsInserted(),
            listingsUpdated + other.listingsUpdated(),
            reviewsInserted + other.reviewsInserted(),
            reviewsDuplicateSkipped + other.reviewsDuplicateSkipped(),
            reviewsRejected + other.reviewsRejected(),
            List.copyOf(merged)
        );
    }
}
