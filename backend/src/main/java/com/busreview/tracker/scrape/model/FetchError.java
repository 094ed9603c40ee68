package com.busreview.tracker.scrape.model;

public record FetchError(
    FetchErrorKind kind,
    TerminalReason terminalReason,
    int attempts,
    String message
) {
    public static FetchError transientFailure(int attempts, String message) {
        return new FetchError(FetchErrorKind.TRANSIENT, null, attempts, message);
    }

    public static FetchError terminal(TerminalReason reason, int attempts, String message) {
        return new FetchError(FetchErrorKind.TERMINAL, reason, attempts, message);
    }

    public boolean isEndOfResults() {
        return kind == FetchErrorKind.TERMINAL && terminalReason == TerminalReason.END_OF_RESULTS;
    }
}
