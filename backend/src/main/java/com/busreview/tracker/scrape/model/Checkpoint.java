package com.busreview.tracker.scrape.model;

import java.time.Instant;
import java.time.LocalDate;

public record Checkpoint(
    String routeKey,
    int lastPageIndex,
    String lastReviewCursor,
    LocalDate journeyDate,
    Instant updatedAt,
    Instant completedAt
) {
    public boolean isCompleted() {
        return completedAt != null;
    }

    public int nextPageIndex() {
        return lastPageIndex + 1;
    }
}
