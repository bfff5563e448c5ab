package com.growthpilot.platform.scheduler.service.retry;

import com.growthpilot.platform.scheduler.client.FailureClass;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryControllerTest {

    private final RetryController controller = new RetryController(
            new ExponentialBackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(1)));

    @Test
    void transientFailureRetriesWithBackoffForTheNextAttempt() {
        RetryDecision decision = controller.decide(0, 3, FailureClass.TRANSIENT);
        assertTrue(decision.isRetry());
        assertEquals(Duration.ofSeconds(60), decision.getDelay());

        decision = controller.decide(2, 3, FailureClass.TRANSIENT);
        assertTrue(decision.isRetry());
        assertEquals(Duration.ofSeconds(240), decision.getDelay());
    }

    @Test
    void failsOnceRetriesAreUsedUp() {
        assertFalse(controller.decide(3, 3, FailureClass.TRANSIENT).isRetry());
        assertFalse(controller.decide(5, 3, FailureClass.TRANSIENT).isRetry());
    }

    @Test
    void zeroMaxRetriesFailsImmediately() {
        assertFalse(controller.decide(0, 0, FailureClass.TRANSIENT).isRetry());
    }

    @Test
    void permanentFailureNeverRetries() {
        assertSame(RetryDecision.fail(), controller.decide(0, 3, FailureClass.PERMANENT));
    }

    @Test
    void retryAfterRaisesButNeverLowersTheDelay() {
        RetryDecision decision = controller.decide(0, 3, FailureClass.TRANSIENT);

        assertEquals(Duration.ofMinutes(15), decision.withMinimumDelay(Duration.ofMinutes(15)).getDelay());
        assertEquals(Duration.ofSeconds(60), decision.withMinimumDelay(Duration.ofSeconds(5)).getDelay());
        assertEquals(Duration.ofSeconds(60), decision.withMinimumDelay(null).getDelay());
        assertFalse(RetryDecision.fail().withMinimumDelay(Duration.ofMinutes(15)).isRetry());
    }

    @Test
    void everyRetrySequenceTerminates() {
        for (int maxRetries = 0; maxRetries <= 10; maxRetries++) {
            int retryCount = 0;
            while (controller.decide(retryCount, maxRetries, FailureClass.TRANSIENT).isRetry()) {
                retryCount++;
            }
            assertEquals(maxRetries, retryCount);
        }
    }
}
