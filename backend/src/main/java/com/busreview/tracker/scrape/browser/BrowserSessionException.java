package com.busreview.tracker.scrape.browser;

public class BrowserSessionException extends RuntimeException {
    private final boolean transientFailure;
    private final Integer statusCode;

    public BrowserSessionException(String message, boolean transientFailure, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public static BrowserSessionException transientFailure(String message, Throwable cause) {
        return new BrowserSessionException(message, true, null, cause);
    }

    public static BrowserSessionException forStatus(int statusCode, String url, Throwable cause) {
        boolean retryable = statusCode == 408 || statusCode == 429 || statusCode >= 500;
        return new BrowserSessionException("HTTP " + statusCode + " for " + url, retryable, statusCode, cause);
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
