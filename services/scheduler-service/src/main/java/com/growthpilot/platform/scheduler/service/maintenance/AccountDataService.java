package com.growthpilot.platform.scheduler.service.maintenance;

import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.repository.RateLimitTrackerRepository;
import com.growthpilot.platform.scheduler.service.growth.GrowthStrategyStore;
import com.growthpilot.platform.scheduler.service.tweet.ScheduledTweetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Removes everything the scheduler holds for a user. Each step commits on its own, so a failure
 * part way leaves the earlier steps done and the call can simply be repeated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountDataService {

    private final ScheduledTweetStore tweetStore;
    private final GrowthStrategyStore strategyStore;
    private final RateLimitTrackerRepository trackerRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public void deleteUserData(UUID userId) {
        int tweets = tweetStore.softDeleteAllForUser(userId, OffsetDateTime.now(clock));

        List<GrowthStrategy> strategies = strategyStore.findByUser(userId);
        for (GrowthStrategy strategy : strategies) {
            strategyStore.deleteStrategy(strategy.getId());
        }

        Integer trackers = transactionTemplate.execute(status -> trackerRepository.deleteByUserId(userId));
        log.info("Deleted scheduler data for user {}: {} tweets soft-deleted, {} strategies, {} trackers",
                userId, tweets, strategies.size(), trackers);
    }
}
