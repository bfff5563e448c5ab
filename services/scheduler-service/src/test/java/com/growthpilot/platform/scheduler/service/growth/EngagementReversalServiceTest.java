package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.dto.EngagementLogResponse;
import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.RateLimitTracker;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import com.growthpilot.platform.scheduler.exception.ForbiddenOperationException;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.exception.QuotaExhaustedException;
import com.growthpilot.platform.scheduler.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EngagementReversalServiceTest extends IntegrationTestSupport {

    @Autowired
    private EngagementReversalService reversalService;

    private final UUID userId = UUID.randomUUID();

    private GrowthStrategy strategy() {
        return strategyRepository.save(GrowthStrategy.builder()
                .userId(userId)
                .name("reversals")
                .status(StrategyStatus.ACTIVE)
                .build());
    }

    private EngagementLog follow(GrowthStrategy strategy, boolean success) {
        return engagementLogRepository.save(EngagementLog.builder()
                .strategyId(strategy.getId())
                .targetId(UUID.randomUUID())
                .actionType(ActionType.FOLLOW)
                .platformUserId("id-dave")
                .platformUsername("dave")
                .success(success)
                .build());
    }

    @Test
    void unfollowIsAppendedAndCounted() {
        GrowthStrategy strategy = strategy();
        EngagementLog original = follow(strategy, true);

        EngagementLogResponse response = reversalService.revert(userId, strategy.getId(), original.getId());

        verify(session).unfollow("id-dave");
        assertEquals(ActionType.UNFOLLOW, response.getActionType());
        assertTrue(response.getSuccess());
        assertEquals(1, strategyRepository.findById(strategy.getId()).orElseThrow().getTotalUnfollows());
        assertEquals(1, trackerRepository.findByUserIdAndTrackerDate(userId, LocalDate.of(2024, 3, 4))
                .orElseThrow().getUnfollowsCount());
        assertEquals(2, engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategy.getId()).size());
    }

    @Test
    void engagementCanOnlyBeRevertedOnce() {
        GrowthStrategy strategy = strategy();
        EngagementLog original = follow(strategy, true);
        reversalService.revert(userId, strategy.getId(), original.getId());

        assertThrows(IllegalStateTransitionException.class,
                () -> reversalService.revert(userId, strategy.getId(), original.getId()));
    }

    @Test
    void failedEngagementCannotBeReverted() {
        GrowthStrategy strategy = strategy();
        EngagementLog original = follow(strategy, false);

        assertThrows(IllegalStateTransitionException.class,
                () -> reversalService.revert(userId, strategy.getId(), original.getId()));
        verify(session, never()).unfollow(anyString());
    }

    @Test
    void unfollowQuotaIsEnforced() {
        GrowthStrategy strategy = strategy();
        EngagementLog original = follow(strategy, true);
        trackerRepository.save(RateLimitTracker.builder()
                .userId(userId)
                .trackerDate(LocalDate.of(2024, 3, 4))
                .unfollowsCount(50)
                .build());

        assertThrows(QuotaExhaustedException.class,
                () -> reversalService.revert(userId, strategy.getId(), original.getId()));
        verify(session, never()).unfollow(anyString());
    }

    @Test
    void otherUsersCannotRevert() {
        GrowthStrategy strategy = strategy();
        EngagementLog original = follow(strategy, true);

        assertThrows(ForbiddenOperationException.class,
                () -> reversalService.revert(UUID.randomUUID(), strategy.getId(), original.getId()));
    }
}
