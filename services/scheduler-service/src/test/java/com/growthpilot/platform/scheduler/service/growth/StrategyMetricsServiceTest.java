package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.FailureClass;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.dto.AccountMetrics;
import com.growthpilot.platform.scheduler.dto.StrategyProgressResponse;
import com.growthpilot.platform.scheduler.entity.DailyProgress;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import com.growthpilot.platform.scheduler.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StrategyMetricsServiceTest extends IntegrationTestSupport {

    @Autowired
    private StrategyMetricsService metricsService;

    private GrowthStrategy active(UUID userId) {
        return strategyRepository.save(GrowthStrategy.builder()
                .userId(userId)
                .name("metrics")
                .status(StrategyStatus.ACTIVE)
                .build());
    }

    @Test
    void followerGainIsMeasuredFromTheFirstSnapshot() {
        GrowthStrategy strategy = active(UUID.randomUUID());
        when(session.accountMetrics())
                .thenReturn(new AccountMetrics(1000, 250, 40))
                .thenReturn(new AccountMetrics(1042, 251, 41));

        metricsService.refresh(strategy.getId());
        metricsService.refresh(strategy.getId());

        GrowthStrategy stored = strategyRepository.findById(strategy.getId()).orElseThrow();
        assertEquals(1000, stored.getStartingFollowers());
        assertEquals(1042, stored.getCurrentFollowers());
        assertEquals(42, stored.getFollowersGained());

        DailyProgress today = progressRepository
                .findByStrategyIdAndProgressDate(strategy.getId(), LocalDate.of(2024, 3, 4)).orElseThrow();
        assertEquals(1042, today.getFollowerCount());
        assertEquals(251, today.getFollowingCount());

        StrategyProgressResponse progress = metricsService.getProgress(strategy.getUserId(), strategy.getId());
        assertEquals(1042, progress.getToday().getFollowerCount());
        assertEquals(1, progress.getHistory().size());
    }

    @Test
    void oneFailingAccountDoesNotStopTheRefresh() {
        UUID healthyUser = UUID.randomUUID();
        UUID brokenUser = UUID.randomUUID();
        GrowthStrategy healthy = active(healthyUser);
        active(brokenUser);

        PlatformSession broken = mock(PlatformSession.class);
        when(broken.accountMetrics()).thenThrow(
                new PlatformClientException(FailureClass.TRANSIENT, "HTTP_503", "connector down"));
        when(platformClient.openSession(brokenUser)).thenReturn(broken);
        when(platformClient.openSession(healthyUser)).thenReturn(session);
        when(session.accountMetrics()).thenReturn(new AccountMetrics(500, 10, 3));

        assertEquals(1, metricsService.refreshMetrics());
        assertEquals(500, strategyRepository.findById(healthy.getId()).orElseThrow().getCurrentFollowers());
    }
}
