package com.growthpilot.platform.scheduler.service.quota;

import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.entity.RateLimitTracker;
import com.growthpilot.platform.scheduler.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaTrackerConcurrencyTest extends IntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    @Autowired
    private QuotaTracker quotaTracker;

    @Test
    void concurrentCallersNeverExceedTheLimit() throws Exception {
        UUID userId = UUID.randomUUID();
        int threads = 16;
        int limit = 5;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return quotaTracker.tryConsume(userId, QuotaAction.FOLLOW, DAY, limit);
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertEquals(limit, granted);
        } finally {
            pool.shutdownNow();
        }

        RateLimitTracker tracker = trackerRepository.findByUserIdAndTrackerDate(userId, DAY).orElseThrow();
        assertEquals(limit, tracker.getFollowsCount());
    }

    @Test
    void aNewDateStartsFromZero() {
        UUID userId = UUID.randomUUID();

        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.LIKE, DAY, 1));
        assertFalse(quotaTracker.tryConsume(userId, QuotaAction.LIKE, DAY, 1));
        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.LIKE, DAY.plusDays(1), 1));
    }

    @Test
    void zeroLimitRefusesEveryCall() {
        assertFalse(quotaTracker.tryConsume(UUID.randomUUID(), QuotaAction.FOLLOW, DAY, 0));
    }

    @Test
    void platformCeilingCapsAGenerousStrategyLimit() {
        // follow ceiling 400 with a 0.95 safety margin
        assertEquals(380, quotaTracker.effectiveLimit(QuotaAction.FOLLOW, 10_000));
        assertEquals(50, quotaTracker.effectiveLimit(QuotaAction.FOLLOW, 50));
    }

    @Test
    void threadsConsumeAllTheirUnitsOrNone() {
        UUID userId = UUID.randomUUID();

        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.POST, DAY, 5, 3));
        assertFalse(quotaTracker.tryConsume(userId, QuotaAction.POST, DAY, 5, 3));
        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.POST, DAY, 5, 2));

        RateLimitTracker tracker = trackerRepository.findByUserIdAndTrackerDate(userId, DAY).orElseThrow();
        assertEquals(5, tracker.getPostsCount());
    }

    @Test
    void retweetsAndRepliesCountAgainstThePostCeiling() {
        UUID userId = UUID.randomUUID();

        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.POST, DAY, Integer.MAX_VALUE, 94));
        assertTrue(quotaTracker.tryConsume(userId, QuotaAction.RETWEET, DAY, 10));
        assertFalse(quotaTracker.tryConsume(userId, QuotaAction.REPLY, DAY, 10));

        RateLimitTracker tracker = trackerRepository.findByUserIdAndTrackerDate(userId, DAY).orElseThrow();
        assertEquals(95, tracker.getPostsCount());
        assertEquals(1, tracker.getRetweetsCount());
        assertEquals(0, tracker.getRepliesCount());
    }

    @Test
    void usageReportsRemainingUnits() {
        UUID userId = UUID.randomUUID();
        quotaTracker.tryConsume(userId, QuotaAction.FOLLOW, DAY, 10);
        quotaTracker.tryConsume(userId, QuotaAction.FOLLOW, DAY, 10);

        int remaining = quotaTracker.getUsage(userId, DAY).getActions().stream()
                .filter(a -> a.getAction() == QuotaAction.FOLLOW)
                .findFirst()
                .orElseThrow()
                .getRemaining();
        assertEquals(378, remaining);
    }
}
