package com.growthpilot.platform.scheduler.service.retry;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryDecision {

    private static final RetryDecision FAIL = new RetryDecision(false, Duration.ZERO);

    private final boolean retry;
    private final Duration delay;

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision fail() {
        return FAIL;
    }

    /** Same decision with the delay raised to at least {@code floor}. */
    public RetryDecision withMinimumDelay(Duration floor) {
        if (!retry || floor == null || floor.compareTo(delay) <= 0) {
            return this;
        }
        return new RetryDecision(true, floor);
    }
}
