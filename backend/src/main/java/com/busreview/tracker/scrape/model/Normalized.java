package com.busreview.tracker.scrape.model;

public record Normalized<T>(T value, String dropReason) {
    public static <T> Normalized<T> of(T value) {
        return new Normalized<>(value, null);
    }

    public static <T> Normalized<T> drop(String reason) {
        return new Normalized<>(null, reason);
    }

    public boolean isDropped() {
        return value == null;
    }
}
