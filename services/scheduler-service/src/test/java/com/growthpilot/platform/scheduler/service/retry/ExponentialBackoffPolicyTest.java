package com.growthpilot.platform.scheduler.service.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffPolicyTest {

    private final ExponentialBackoffPolicy policy =
            new ExponentialBackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(1));

    @Test
    void doublesFromBaseDelay() {
        assertEquals(Duration.ofSeconds(60), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(120), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(240), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(480), policy.delayFor(4));
    }

    @Test
    void capsAtMaxDelay() {
        assertEquals(Duration.ofHours(1), policy.delayFor(7));
        assertEquals(Duration.ofHours(1), policy.delayFor(40));
        assertEquals(Duration.ofHours(1), policy.delayFor(Integer.MAX_VALUE));
    }

    @Test
    void neverDecreases() {
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 64; attempt++) {
            Duration delay = policy.delayFor(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1)));
    }
}
