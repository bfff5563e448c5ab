package com.growthpilot.platform.scheduler.service.retry;

import com.growthpilot.platform.scheduler.client.FailureClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pure retry decision: no I/O and no clock. The caller turns the delay into a next attempt time.
 */
@Component
@RequiredArgsConstructor
public class RetryController {

    private final BackoffPolicy backoffPolicy;

    public RetryDecision decide(int retryCount, int maxRetries, FailureClass failureClass) {
        if (failureClass == FailureClass.PERMANENT) {
            return RetryDecision.fail();
        }
        if (retryCount >= maxRetries) {
            return RetryDecision.fail();
        }
        return RetryDecision.retryAfter(backoffPolicy.delayFor(retryCount + 1));
    }
}
