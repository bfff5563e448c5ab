package com.growthpilot.platform.scheduler.service.log;

import com.growthpilot.platform.scheduler.dto.PostResult;
import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.DailyProgress;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TargetType;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import com.growthpilot.platform.scheduler.service.tweet.TweetAttemptOutcome;
import com.growthpilot.platform.scheduler.service.tweet.TweetClaim;
import com.growthpilot.platform.scheduler.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionLogRecorderTest extends IntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    @Autowired
    private ExecutionLogRecorder recorder;

    private GrowthStrategy strategy() {
        return strategyRepository.save(GrowthStrategy.builder().userId(UUID.randomUUID()).name("log").build());
    }

    @Test
    void tweetAttemptMustJoinTheFinalizeTransaction() {
        ScheduledTweet tweet = ScheduledTweet.builder().id(UUID.randomUUID()).content("x").build();
        TweetAttemptOutcome outcome = TweetAttemptOutcome.posted(PostResult.posted("1", null),
                OffsetDateTime.now(clock), OffsetDateTime.now(clock));

        assertThrows(IllegalTransactionStateException.class,
                () -> recorder.recordTweetAttempt(tweet, TweetClaim.of(tweet, TweetStatus.PENDING), outcome));
    }

    @Test
    void successfulEngagementMovesEveryCounterTogether() {
        GrowthStrategy strategy = strategy();
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.TWEET)
                .tweetId("t-9")
                .shouldLike(true)
                .build());

        recorder.recordEngagement(EngagementLog.builder()
                .strategyId(strategy.getId())
                .targetId(target.getId())
                .actionType(ActionType.LIKE)
                .tweetId("t-9")
                .success(true)
                .build(), DAY);

        assertEquals(1, strategyRepository.findById(strategy.getId()).orElseThrow().getTotalLikes());
        DailyProgress progress = progressRepository.findByStrategyIdAndProgressDate(strategy.getId(), DAY).orElseThrow();
        assertEquals(1, progress.countFor(QuotaAction.LIKE));
        assertTrue(targetRepository.findById(target.getId()).orElseThrow().getLikeDone());
        assertEquals(1, engagementLogRepository.countByStrategyIdAndActionTypeAndSuccessTrue(
                strategy.getId(), ActionType.LIKE));
    }

    @Test
    void failedEngagementOnlyAppendsTheLog() {
        GrowthStrategy strategy = strategy();

        recorder.recordEngagement(EngagementLog.builder()
                .strategyId(strategy.getId())
                .actionType(ActionType.FOLLOW)
                .platformUserId("42")
                .success(false)
                .errorCode("HTTP_403")
                .build(), DAY);

        assertEquals(0, strategyRepository.findById(strategy.getId()).orElseThrow().getTotalFollows());
        assertTrue(progressRepository.findByStrategyIdAndProgressDate(strategy.getId(), DAY).isEmpty());
        assertEquals(1, engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategy.getId()).size());
    }

    @Test
    void followerSnapshotLandsOnTheDaysProgress() {
        GrowthStrategy strategy = strategy();

        recorder.recordFollowerSnapshot(strategy.getId(), DAY, 1200, 300);
        recorder.recordFollowerSnapshot(strategy.getId(), DAY, 1210, 301);

        DailyProgress progress = progressRepository.findByStrategyIdAndProgressDate(strategy.getId(), DAY).orElseThrow();
        assertEquals(1210, progress.getFollowerCount());
        assertEquals(301, progress.getFollowingCount());
        assertEquals(1, progressRepository.findByStrategyIdOrderByProgressDateAsc(strategy.getId()).size());
    }
}
