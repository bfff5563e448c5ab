package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.dto.EngagementTargetResponse;
import com.growthpilot.platform.scheduler.dto.StrategyResponse;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.exception.InvalidStrategyException;
import com.growthpilot.platform.scheduler.service.audit.AuditEventType;
import com.growthpilot.platform.scheduler.service.audit.AuditPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyLifecycleService {

    private final GrowthStrategyStore strategyStore;
    private final EngagementTargetStore targetStore;
    private final AuditPublisher auditPublisher;
    private final Clock clock;

    public StrategyResponse activate(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (strategy.getStartDate() == null) {
            strategy.setStartDate(now);
        }
        if (strategy.getEndDate() != null && !strategy.getEndDate().isAfter(strategy.getStartDate())) {
            throw new InvalidStrategyException("Strategy end date must be after its start date");
        }
        return mapToResponse(change(strategy, EnumSet.of(StrategyStatus.DRAFT), StrategyStatus.ACTIVE));
    }

    public StrategyResponse pause(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        return mapToResponse(change(strategy, EnumSet.of(StrategyStatus.ACTIVE), StrategyStatus.PAUSED));
    }

    public StrategyResponse resume(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        return mapToResponse(change(strategy, EnumSet.of(StrategyStatus.PAUSED), StrategyStatus.ACTIVE));
    }

    public StrategyResponse cancel(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        return mapToResponse(change(strategy, EnumSet.allOf(StrategyStatus.class), StrategyStatus.CANCELLED));
    }

    public void delete(UUID userId, UUID strategyId) {
        strategyStore.getOwned(userId, strategyId);
        strategyStore.deleteStrategy(strategyId);
    }

    public EngagementTargetResponse approveReply(UUID userId, UUID strategyId, UUID targetId) {
        strategyStore.getOwned(userId, strategyId);
        EngagementTarget target = targetStore.approveReply(strategyId, targetId);
        return EngagementTargetResponse.builder()
                .id(target.getId())
                .strategyId(target.getStrategyId())
                .targetType(target.getTargetType())
                .handle(target.handle())
                .tweetId(target.getTweetId())
                .status(target.getStatus())
                .replyContent(target.getReplyContent())
                .replyApproved(target.getReplyApproved())
                .scheduledFor(target.getScheduledFor())
                .executedAt(target.getExecutedAt())
                .errorMessage(target.getErrorMessage())
                .build();
    }

    /** Called by the scheduler once the end date has passed. */
    public GrowthStrategy completeExpired(GrowthStrategy strategy) {
        log.info("Strategy {} reached its end date {}", strategy.getId(), strategy.getEndDate());
        return change(strategy, EnumSet.of(StrategyStatus.ACTIVE, StrategyStatus.PAUSED), StrategyStatus.COMPLETED);
    }

    private GrowthStrategy change(GrowthStrategy strategy, Set<StrategyStatus> allowedFrom, StrategyStatus next) {
        StrategyStatus previous = strategy.getStatus();
        if (previous.isTerminal()) {
            throw new IllegalStateTransitionException("Strategy " + strategy.getId() + " is already " + previous);
        }
        if (!allowedFrom.contains(previous) || !previous.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("GrowthStrategy", strategy.getId(), previous, next);
        }
        strategy.transitionTo(next);
        GrowthStrategy saved = strategyStore.save(strategy);
        log.info("Strategy {} moved from {} to {}", saved.getId(), previous, next);
        auditPublisher.publish(AuditEventType.STRATEGY_STATUS_CHANGED, saved.getUserId(), saved.getId(),
                next, previous + " -> " + next);
        return saved;
    }

    static StrategyResponse mapToResponse(GrowthStrategy strategy) {
        return StrategyResponse.builder()
                .id(strategy.getId())
                .userId(strategy.getUserId())
                .name(strategy.getName())
                .status(strategy.getStatus())
                .startDate(strategy.getStartDate())
                .endDate(strategy.getEndDate())
                .timezone(strategy.getTimezone())
                .engagementHoursStart(strategy.getEngagementHoursStart())
                .engagementHoursEnd(strategy.getEngagementHoursEnd())
                .totalFollows(strategy.getTotalFollows())
                .totalUnfollows(strategy.getTotalUnfollows())
                .totalLikes(strategy.getTotalLikes())
                .totalRetweets(strategy.getTotalRetweets())
                .totalReplies(strategy.getTotalReplies())
                .totalPosts(strategy.getTotalPosts())
                .startingFollowers(strategy.getStartingFollowers())
                .currentFollowers(strategy.getCurrentFollowers())
                .followersGained(strategy.getFollowersGained())
                .build();
    }
}
