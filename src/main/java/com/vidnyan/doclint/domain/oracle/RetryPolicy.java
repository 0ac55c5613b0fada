package com.vidnyan.doclint.domain.oracle;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Attempt budget and exponential backoff with jitter for oracle calls.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxJitter
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(300);
    public static final Duration DEFAULT_MAX_JITTER = Duration.ofMillis(200);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxJitter == null || maxJitter.isNegative()) {
            throw new IllegalArgumentException("maxJitter must be non-negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_JITTER);
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based):
     * {@code base * 2^(attempt-1) + uniform[0, maxJitter)}.
     */
    public Duration backoff(int attempt) {
        long base = baseDelay.toMillis() << Math.min(Math.max(attempt - 1, 0), 20);
        long jitterBound = maxJitter.toMillis();
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0;
        return Duration.ofMillis(base + jitter);
    }
}
