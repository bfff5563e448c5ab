package com.growthpilot.platform.scheduler.service.retry;

import java.time.Duration;

/**
 * Computes the wait before a retry. Implementations must be monotonically non-decreasing in the attempt number.
 */
public interface BackoffPolicy {

    /**
     * @param attempt 1-based number of the retry being scheduled
     */
    Duration delayFor(int attempt);
}
