package com.busreview.tracker.scrape.fetch;

import com.busreview.tracker.config.PipelineProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    LongUnaryOperator jitter
) {
    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        jitter = jitter == null ? RetryPolicy::randomJitter : jitter;
    }

    public static RetryPolicy from(PipelineProperties.Fetch fetch) {
        return new RetryPolicy(
            fetch.getMaxAttempts(),
            Duration.ofMillis(fetch.getRetryBaseDelayMs()),
            Duration.ofMillis(fetch.getRetryMaxDelayMs()),
            RetryPolicy::randomJitter
        );
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay after the given failed attempt (1-based): half of the capped exponential delay plus jitter
     * over the other half.
     */
    public Duration backoffAfter(int attempt) {
        long baseMs = baseDelay.toMillis();
        if (baseMs <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = baseMs * (1L << shift);
        long maxMs = maxDelay.toMillis();
        if (maxMs > 0) {
            delay = Math.min(delay, maxMs);
        }
        long half = delay / 2;
        long jitterMs = Math.max(0L, Math.min(delay - half, jitter.applyAsLong(Math.max(1L, delay - half))));
        return Duration.ofMillis(half + jitterMs);
    }

    static long randomJitter(long bound) {
        return ThreadLocalRandom.current().nextLong(Math.max(1L, bound));
    }
}
