package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.dto.GrowthCycleReport;
import com.growthpilot.platform.scheduler.dto.PostResult;
import com.growthpilot.platform.scheduler.dto.StrategyCycleResult;
import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.DailyProgress;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.EngagementStatus;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import com.growthpilot.platform.scheduler.entity.TargetType;
import com.growthpilot.platform.scheduler.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GrowthStrategySchedulerTest extends IntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    @Autowired
    private GrowthStrategyScheduler scheduler;

    @Autowired
    private StrategyLifecycleService lifecycleService;

    @Autowired
    private SchedulerProperties properties;

    private final UUID userId = UUID.randomUUID();

    private GrowthStrategy.GrowthStrategyBuilder activeStrategy() {
        return GrowthStrategy.builder()
                .userId(userId)
                .name("Grow dev audience")
                .status(StrategyStatus.ACTIVE)
                .startDate(OffsetDateTime.ofInstant(START, ZoneOffset.UTC).minusDays(1))
                .engagementHoursStart(0)
                .engagementHoursEnd(0);
    }

    private EngagementTarget account(GrowthStrategy strategy, String handle, int priority) {
        return targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.ACCOUNT)
                .platformUserId("id-" + handle)
                .platformUsername(handle)
                .shouldFollow(true)
                .priority(priority)
                .build());
    }

    private EngagementTarget reload(EngagementTarget target) {
        return targetRepository.findById(target.getId()).orElseThrow();
    }

    private StrategyCycleResult onlyResult(GrowthCycleReport report) {
        assertEquals(1, report.getStrategies().size());
        return report.getStrategies().get(0);
    }

    @Test
    void dailyFollowLimitOfTwoCompletesTwoTargetsAndSkipsTheRest() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().dailyFollows(2).build());
        List<EngagementTarget> targets = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            targets.add(account(strategy, "user" + i, 0));
        }

        StrategyCycleResult result = onlyResult(scheduler.runCycle());

        assertEquals(StrategyCycleResult.Status.PROCESSED, result.getStatus());
        assertEquals(2, result.getCompleted());
        assertEquals(3, result.getSkipped());
        verify(session, times(2)).follow(anyString());

        long completed = targets.stream().map(this::reload)
                .filter(t -> t.getStatus() == EngagementStatus.COMPLETED).count();
        long skipped = targets.stream().map(this::reload)
                .filter(t -> t.getStatus() == EngagementStatus.SKIPPED).count();
        assertEquals(2, completed);
        assertEquals(3, skipped);

        assertEquals(2, trackerRepository.findByUserIdAndTrackerDate(userId, DAY).orElseThrow().getFollowsCount());
        assertEquals(2, strategyRepository.findById(strategy.getId()).orElseThrow().getTotalFollows());
        DailyProgress progress = progressRepository.findByStrategyIdAndProgressDate(strategy.getId(), DAY).orElseThrow();
        assertEquals(2, progress.getFollowsDone());
        assertEquals(2, engagementLogRepository.countByStrategyIdAndActionTypeAndSuccessTrue(
                strategy.getId(), ActionType.FOLLOW));
    }

    @Test
    void avoidedAccountIsSkippedWithoutAnyAction() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy()
                .avoidAccounts(new ArrayList<>(List.of("Spammer")))
                .build());
        EngagementTarget avoided = account(strategy, "@spammer", 0);

        scheduler.runCycle();

        assertEquals(EngagementStatus.SKIPPED, reload(avoided).getStatus());
        verify(session, never()).follow(anyString());
        assertTrue(engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategy.getId()).isEmpty());
    }

    @Test
    void targetsRunInPriorityThenRelevanceThenIdOrder() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        account(strategy, "low", 1);
        account(strategy, "high", 5);
        account(strategy, "mid", 3);

        scheduler.runCycle();

        InOrder order = inOrder(session);
        order.verify(session).follow("id-high");
        order.verify(session).follow("id-mid");
        order.verify(session).follow("id-low");
    }

    @Test
    void strategyOutsideItsEngagementHoursIsLeftAlone() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy()
                .engagementHoursStart(1)
                .engagementHoursEnd(2)
                .build());
        EngagementTarget target = account(strategy, "later", 0);

        StrategyCycleResult result = onlyResult(scheduler.runCycle());

        assertEquals(StrategyCycleResult.Status.OUTSIDE_HOURS, result.getStatus());
        assertEquals(EngagementStatus.PENDING, reload(target).getStatus());
        verifyNoInteractions(platformClient);
    }

    @Test
    void rateLimitStopsTheRestOfTheStrategyCycle() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        EngagementTarget first = account(strategy, "first", 3);
        EngagementTarget second = account(strategy, "second", 2);
        EngagementTarget third = account(strategy, "third", 1);
        doThrow(PlatformClientException.fromStatus(429, "Too many requests", null, null))
                .when(session).follow("id-first");

        StrategyCycleResult result = onlyResult(scheduler.runCycle());

        assertEquals(StrategyCycleResult.Status.RATE_LIMITED, result.getStatus());
        verify(session, times(1)).follow(anyString());

        EngagementTarget retrying = reload(first);
        assertEquals(EngagementStatus.PENDING, retrying.getStatus());
        assertEquals(1, retrying.getAttemptCount());
        assertTrue(retrying.getScheduledFor().toInstant().isAfter(START));
        assertEquals(EngagementStatus.PENDING, reload(second).getStatus());
        assertEquals(EngagementStatus.PENDING, reload(third).getStatus());
    }

    @Test
    void permanentFailureFailsTheTarget() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        EngagementTarget target = account(strategy, "gone", 0);
        doThrow(PlatformClientException.fromStatus(404, "User not found", null, null))
                .when(session).follow("id-gone");

        scheduler.runCycle();

        EngagementTarget failed = reload(target);
        assertEquals(EngagementStatus.FAILED, failed.getStatus());
        assertEquals("[HTTP_404] User not found", failed.getErrorMessage());
    }

    @Test
    void tweetTargetRunsEveryRequestedAction() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.TWEET)
                .tweetId("t-1")
                .tweetAuthor("carol")
                .tweetAuthorId("id-carol")
                .shouldFollow(true)
                .shouldLike(true)
                .shouldReply(true)
                .replyContent("Great thread")
                .build());
        when(session.reply("t-1", "Great thread")).thenReturn(PostResult.posted("r-1", null));

        scheduler.runCycle();

        verify(session).follow("id-carol");
        verify(session).like("t-1");
        verify(session).reply("t-1", "Great thread");
        EngagementTarget done = reload(target);
        assertEquals(EngagementStatus.COMPLETED, done.getStatus());
        assertTrue(done.getFollowDone() && done.getLikeDone() && done.getReplyDone());
        assertEquals(1, trackerRepository.findByUserIdAndTrackerDate(userId, DAY).orElseThrow().getPostsCount());
    }

    @Test
    void unapprovedReplyWaitsForApproval() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().requireReplyApproval(true).build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.TWEET)
                .tweetId("t-2")
                .shouldReply(true)
                .replyContent("Agreed")
                .build());
        when(session.reply("t-2", "Agreed")).thenReturn(PostResult.posted("r-2", null));

        assertEquals(StrategyCycleResult.Status.NO_WORK, onlyResult(scheduler.runCycle()).getStatus());
        verify(session, never()).reply(anyString(), anyString());

        lifecycleService.approveReply(userId, strategy.getId(), target.getId());
        scheduler.runCycle();

        verify(session).reply("t-2", "Agreed");
        assertEquals(EngagementStatus.COMPLETED, reload(target).getStatus());
    }

    @Test
    void likeRunsWhileReplyWaitsForApproval() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().requireReplyApproval(true).build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.TWEET)
                .tweetId("t-9")
                .shouldLike(true)
                .shouldReply(true)
                .replyContent("hi")
                .build());
        when(session.reply("t-9", "hi")).thenReturn(PostResult.posted("r-9", null));

        StrategyCycleResult first = onlyResult(scheduler.runCycle());

        assertEquals(StrategyCycleResult.Status.PROCESSED, first.getStatus());
        assertEquals(1, first.getAwaitingApproval());
        verify(session).like("t-9");
        verify(session, never()).reply(anyString(), anyString());
        EngagementTarget waiting = reload(target);
        assertEquals(EngagementStatus.PENDING, waiting.getStatus());
        assertTrue(waiting.getLikeDone());
        assertEquals("Reply awaiting approval", waiting.getErrorMessage());

        assertEquals(StrategyCycleResult.Status.NO_WORK, onlyResult(scheduler.runCycle()).getStatus());

        lifecycleService.approveReply(userId, strategy.getId(), target.getId());
        scheduler.runCycle();

        verify(session, times(1)).like("t-9");
        verify(session).reply("t-9", "hi");
        assertEquals(EngagementStatus.COMPLETED, reload(target).getStatus());
    }

    @Test
    void accountKnownOnlyByHandleIsLookedUpBeforeFollowing() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.ACCOUNT)
                .platformUsername("dora")
                .shouldFollow(true)
                .build());
        when(session.lookupAccountId("dora")).thenReturn("id-dora");

        scheduler.runCycle();

        verify(session).follow("id-dora");
        EngagementTarget done = reload(target);
        assertEquals(EngagementStatus.COMPLETED, done.getStatus());
        assertEquals("id-dora", done.getPlatformUserId());
        List<EngagementLog> logs = engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategy.getId());
        assertEquals(1, logs.size());
        assertEquals("id-dora", logs.get(0).getPlatformUserId());
    }

    @Test
    void unknownHandleFailsTheTargetWithALoggedAttempt() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.ACCOUNT)
                .platformUsername("ghost")
                .shouldFollow(true)
                .build());
        when(session.lookupAccountId("ghost")).thenReturn(null);

        StrategyCycleResult result = onlyResult(scheduler.runCycle());

        assertEquals(1, result.getFailed());
        verify(session, never()).follow(anyString());
        EngagementTarget failed = reload(target);
        assertEquals(EngagementStatus.FAILED, failed.getStatus());
        assertEquals("[USER_NOT_FOUND] User not found: @ghost", failed.getErrorMessage());
        List<EngagementLog> logs = engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategy.getId());
        assertEquals(1, logs.size());
        assertFalse(logs.get(0).getSuccess());
        assertEquals("USER_NOT_FOUND", logs.get(0).getErrorCode());
    }

    @Test
    void avoidListAlsoMatchesPlatformIds() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy()
                .avoidAccounts(new ArrayList<>(List.of("id-blocked")))
                .build());
        EngagementTarget target = targetRepository.save(EngagementTarget.builder()
                .strategyId(strategy.getId())
                .targetType(TargetType.ACCOUNT)
                .platformUserId("id-blocked")
                .shouldFollow(true)
                .build());

        scheduler.runCycle();

        assertEquals(EngagementStatus.SKIPPED, reload(target).getStatus());
        verify(session, never()).follow(anyString());
    }

    @Test
    void deferPolicyReschedulesToTheNextLocalDay() {
        properties.getGrowth().setQuotaExhaustedPolicy(SchedulerProperties.QuotaExhaustedPolicy.DEFER);
        try {
            GrowthStrategy strategy = strategyRepository.save(activeStrategy().dailyFollows(1).build());
            account(strategy, "a", 2);
            EngagementTarget deferred = account(strategy, "b", 1);

            scheduler.runCycle();

            EngagementTarget pending = reload(deferred);
            assertEquals(EngagementStatus.PENDING, pending.getStatus());
            assertEquals(OffsetDateTime.parse("2024-03-05T00:00:00Z").toInstant(),
                    pending.getScheduledFor().toInstant());
        } finally {
            properties.getGrowth().setQuotaExhaustedPolicy(SchedulerProperties.QuotaExhaustedPolicy.SKIP);
        }
    }

    @Test
    void strategyPastItsEndDateIsCompleted() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy()
                .endDate(OffsetDateTime.ofInstant(START, ZoneOffset.UTC).minusHours(1))
                .build());
        account(strategy, "late", 0);

        StrategyCycleResult result = onlyResult(scheduler.runCycle());

        assertEquals(StrategyCycleResult.Status.COMPLETED_STRATEGY, result.getStatus());
        assertEquals(StrategyStatus.COMPLETED, strategyRepository.findById(strategy.getId()).orElseThrow().getStatus());
        verifyNoInteractions(platformClient);
    }

    @Test
    void strategyNotYetStartedIsSkipped() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy()
                .startDate(OffsetDateTime.ofInstant(START, ZoneOffset.UTC).plusDays(1))
                .build());
        account(strategy, "soon", 0);

        assertEquals(StrategyCycleResult.Status.NOT_STARTED, onlyResult(scheduler.runCycle()).getStatus());
        verifyNoInteractions(platformClient);
    }

    @Test
    void pausedStrategyIsNotProcessed() {
        GrowthStrategy strategy = strategyRepository.save(activeStrategy().build());
        account(strategy, "anyone", 0);

        lifecycleService.pause(userId, strategy.getId());

        assertTrue(scheduler.runCycle().getStrategies().isEmpty());
        verifyNoInteractions(platformClient);
    }
}
