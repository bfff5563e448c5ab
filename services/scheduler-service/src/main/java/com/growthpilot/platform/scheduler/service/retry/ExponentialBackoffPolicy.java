package com.growthpilot.platform.scheduler.service.retry;

import java.time.Duration;

/**
 * {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. No jitter, so the sequence never decreases.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        if (attempt >= 31) {
            return Duration.ofMillis(maxDelayMs);
        }
        long shift = 1L << (attempt - 1);
        long delay = shift > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * shift;
        return Duration.ofMillis(Math.min(maxDelayMs, delay));
    }
}
