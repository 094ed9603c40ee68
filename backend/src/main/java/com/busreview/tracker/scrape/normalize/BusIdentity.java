package com.busreview.tracker.scrape.normalize;

import com.busreview.tracker.scrape.util.HashUtils;

import java.time.LocalDate;

public final class BusIdentity {
    private BusIdentity() {
    }

    /**
     * Operator, route and departure identify a bus; the bus name stands in for a missing departure.
     */
    public static String busId(String operatorName, String origin, String destination, String departureTime, String busName) {
        String departure = TextCleaner.keyForm(departureTime);
        if (departure.isEmpty()) {
            departure = TextCleaner.keyForm(busName);
        }
        return HashUtils.sha256Key(
            TextCleaner.keyForm(operatorName),
            TextCleaner.keyForm(origin),
            TextCleaner.keyForm(destination),
            departure
        );
    }

    public static String textHash(String reviewText) {
        return HashUtils.sha256Hex(TextCleaner.keyForm(reviewText));
    }

    public static String reviewId(String busId, String textHash, LocalDate reviewDate) {
        return HashUtils.sha256Key(busId, textHash, reviewDate == null ? "" : reviewDate.toString());
    }
}
