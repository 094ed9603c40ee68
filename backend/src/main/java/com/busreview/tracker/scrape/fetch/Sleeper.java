package com.busreview.tracker.scrape.fetch;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    /**
     * @return false when the sleep was interrupted; the interrupt flag is restored
     */
    boolean sleep(Duration duration);

    static Sleeper threadSleeper() {
        return duration -> {
            long millis = duration == null ? 0 : duration.toMillis();
            if (millis <= 0) {
                return true;
            }
            try {
                Thread.sleep(millis);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
    }
}
