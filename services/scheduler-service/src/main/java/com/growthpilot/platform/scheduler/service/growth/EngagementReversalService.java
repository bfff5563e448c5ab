package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.PlatformClient;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.dto.EngagementLogResponse;
import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.exception.QuotaExhaustedException;
import com.growthpilot.platform.scheduler.exception.ResourceNotFoundException;
import com.growthpilot.platform.scheduler.repository.EngagementLogRepository;
import com.growthpilot.platform.scheduler.service.audit.AuditEventType;
import com.growthpilot.platform.scheduler.service.audit.AuditPublisher;
import com.growthpilot.platform.scheduler.service.log.ExecutionLogRecorder;
import com.growthpilot.platform.scheduler.service.quota.QuotaTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Undo a successful follow, like or retweet. The original log row is left as it is; the reversal
 * is appended as its own entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementReversalService {

    private final GrowthStrategyStore strategyStore;
    private final EngagementLogRepository engagementLogRepository;
    private final ExecutionLogRecorder logRecorder;
    private final QuotaTracker quotaTracker;
    private final PlatformClient platformClient;
    private final AuditPublisher auditPublisher;
    private final Clock clock;

    public EngagementLogResponse revert(UUID userId, UUID strategyId, UUID logId) {
        GrowthStrategy strategy = strategyStore.getOwned(userId, strategyId);
        EngagementLog original = engagementLogRepository.findById(logId)
                .filter(l -> l.getStrategyId().equals(strategyId))
                .orElseThrow(() -> new ResourceNotFoundException("EngagementLog", logId));

        if (!Boolean.TRUE.equals(original.getSuccess())) {
            throw new IllegalStateTransitionException("Engagement " + logId + " did not succeed and cannot be reverted");
        }
        Optional<ActionType> inverse = original.getActionType().inverse();
        if (inverse.isEmpty()) {
            throw new IllegalStateTransitionException(original.getActionType() + " cannot be reverted");
        }
        ActionType reversal = inverse.get();
        if (original.getTargetId() != null
                && engagementLogRepository.existsByTargetIdAndActionTypeAndSuccessTrue(original.getTargetId(), reversal)) {
            throw new IllegalStateTransitionException("Engagement " + logId + " was already reverted");
        }

        LocalDate day = strategy.localDate(OffsetDateTime.now(clock));
        Optional<QuotaAction> quotaAction = reversal.quotaAction();
        if (quotaAction.isPresent() && !quotaTracker.tryConsume(strategy.getUserId(), quotaAction.get(), day,
                strategy.dailyLimitFor(quotaAction.get()))) {
            throw new QuotaExhaustedException("Daily " + quotaAction.get() + " quota reached for " + day);
        }

        EngagementLog.EngagementLogBuilder entry = EngagementLog.builder()
                .strategyId(strategyId)
                .targetId(original.getTargetId())
                .actionType(reversal)
                .platformUserId(original.getPlatformUserId())
                .platformUsername(original.getPlatformUsername())
                .tweetId(original.getTweetId());

        try (PlatformSession session = platformClient.openSession(strategy.getUserId())) {
            switch (reversal) {
                case UNFOLLOW -> session.unfollow(original.getPlatformUserId());
                case UNLIKE -> session.unlike(original.getTweetId());
                case UNRETWEET -> session.unretweet(original.getTweetId());
                default -> throw new IllegalStateException("Unexpected reversal " + reversal);
            }
        } catch (PlatformClientException e) {
            logRecorder.recordEngagement(entry.success(false)
                    .errorCode(e.getErrorCode())
                    .errorMessage(e.getMessage())
                    .build(), day);
            throw e;
        }

        EngagementLog saved = logRecorder.recordEngagement(entry.success(true).build(), day);
        log.info("Reverted {} {} for strategy {}", original.getActionType(), logId, strategyId);
        auditPublisher.publish(AuditEventType.ENGAGEMENT_REVERTED, userId, logId, reversal,
                original.getActionType() + " reverted");
        return StrategyMetricsService.mapToResponse(saved);
    }
}
