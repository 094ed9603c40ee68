package com.busreview.tracker.scrape.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag and optional deadline shared by the workers of one run. Checked before each fetch.
 */
public class ScrapeRunControl {
    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ScrapeRunControl(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static ScrapeRunControl withMaxDuration(Clock clock, int maxDurationSeconds) {
        Instant deadline = maxDurationSeconds > 0
            ? Instant.now(clock).plus(Duration.ofSeconds(maxDurationSeconds))
            : null;
        return new ScrapeRunControl(clock, deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDeadlineReached() {
        return deadline != null && !Instant.now(clock).isBefore(deadline);
    }

    public boolean shouldStop() {
        return isCancelled() || isDeadlineReached() || Thread.currentThread().isInterrupted();
    }
}
