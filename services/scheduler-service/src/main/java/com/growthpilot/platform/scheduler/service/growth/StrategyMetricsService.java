package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.PlatformClient;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.dto.AccountMetrics;
import com.growthpilot.platform.scheduler.dto.DailyProgressResponse;
import com.growthpilot.platform.scheduler.dto.EngagementLogResponse;
import com.growthpilot.platform.scheduler.dto.StrategyProgressResponse;
import com.growthpilot.platform.scheduler.entity.DailyProgress;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.EngagementStatus;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.repository.DailyProgressRepository;
import com.growthpilot.platform.scheduler.repository.EngagementLogRepository;
import com.growthpilot.platform.scheduler.service.log.ExecutionLogRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Follower snapshots and progress reporting for growth strategies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyMetricsService {

    private final GrowthStrategyStore strategyStore;
    private final EngagementTargetStore targetStore;
    private final DailyProgressRepository progressRepository;
    private final EngagementLogRepository engagementLogRepository;
    private final ExecutionLogRecorder logRecorder;
    private final PlatformClient platformClient;
    private final Clock clock;

    /**
     * Pull account metrics for every ACTIVE strategy and store them on the strategy and on
     * today's progress row.
     *
     * @return number of strategies refreshed
     */
    public int refreshMetrics() {
        int refreshed = 0;
        for (GrowthStrategy strategy : strategyStore.findActive()) {
            try {
                refresh(strategy.getId());
                refreshed++;
            } catch (PlatformClientException e) {
                log.warn("Could not read account metrics for strategy {}: {}", strategy.getId(), e.getMessage());
            } catch (OptimisticLockingFailureException e) {
                log.info("Strategy {} changed during metrics refresh; it will be refreshed next time", strategy.getId());
            }
        }
        log.info("Refreshed metrics for {} strategies", refreshed);
        return refreshed;
    }

    public void refresh(UUID strategyId) {
        GrowthStrategy strategy = strategyStore.get(strategyId);
        AccountMetrics metrics;
        try (PlatformSession session = platformClient.openSession(strategy.getUserId())) {
            metrics = session.accountMetrics();
        }
        if (metrics.getFollowersCount() == null) {
            log.warn("Platform returned no follower count for user {}", strategy.getUserId());
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        GrowthStrategy current = strategyStore.get(strategyId);
        current.recordFollowerCount(metrics.getFollowersCount());
        strategyStore.save(current);
        logRecorder.recordFollowerSnapshot(strategyId, current.localDate(now),
                metrics.getFollowersCount(), metrics.getFollowingCount());
        log.debug("Strategy {} followers now {} ({} gained)", strategyId,
                current.getCurrentFollowers(), current.getFollowersGained());
    }

    public StrategyProgressResponse getProgress(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        LocalDate today = strategy.localDate(OffsetDateTime.now(clock));

        List<DailyProgressResponse> history = progressRepository.findByStrategyIdOrderByProgressDateAsc(strategyId)
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
        DailyProgressResponse todayProgress = history.stream()
                .filter(p -> today.equals(p.getDate()))
                .findFirst()
                .orElseGet(() -> emptyProgress(today));

        return StrategyProgressResponse.builder()
                .strategy(StrategyLifecycleService.mapToResponse(strategy))
                .today(todayProgress)
                .history(history)
                .pendingTargets(targetStore.count(strategyId, EngagementStatus.PENDING))
                .completedTargets(targetStore.count(strategyId, EngagementStatus.COMPLETED))
                .failedTargets(targetStore.count(strategyId, EngagementStatus.FAILED))
                .skippedTargets(targetStore.count(strategyId, EngagementStatus.SKIPPED))
                .build();
    }

    public List<EngagementLogResponse> getEngagementLogs(UUID userId, UUID strategyId) {
        strategyStore.getOwned(userId, strategyId);
        return engagementLogRepository.findByStrategyIdOrderByCreatedAtAsc(strategyId)
                .stream()
                .map(StrategyMetricsService::mapToResponse)
                .collect(Collectors.toList());
    }

    static EngagementLogResponse mapToResponse(EngagementLog entry) {
        return EngagementLogResponse.builder()
                .id(entry.getId())
                .targetId(entry.getTargetId())
                .actionType(entry.getActionType())
                .platformUserId(entry.getPlatformUserId())
                .tweetId(entry.getTweetId())
                .success(entry.getSuccess())
                .errorCode(entry.getErrorCode())
                .errorMessage(entry.getErrorMessage())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private DailyProgressResponse mapToResponse(DailyProgress progress) {
        return DailyProgressResponse.builder()
                .date(progress.getProgressDate())
                .followsDone(progress.getFollowsDone())
                .unfollowsDone(progress.getUnfollowsDone())
                .likesDone(progress.getLikesDone())
                .retweetsDone(progress.getRetweetsDone())
                .repliesDone(progress.getRepliesDone())
                .postsDone(progress.getPostsDone())
                .followerCount(progress.getFollowerCount())
                .followingCount(progress.getFollowingCount())
                .build();
    }

    private DailyProgressResponse emptyProgress(LocalDate date) {
        return DailyProgressResponse.builder()
                .date(date)
                .followsDone(0)
                .unfollowsDone(0)
                .likesDone(0)
                .retweetsDone(0)
                .repliesDone(0)
                .postsDone(0)
                .build();
    }
}
