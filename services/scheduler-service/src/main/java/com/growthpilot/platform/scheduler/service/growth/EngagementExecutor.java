package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.FailureClass;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.service.audit.AuditEventType;
import com.growthpilot.platform.scheduler.service.audit.AuditPublisher;
import com.growthpilot.platform.scheduler.service.guard.EngagementBurstGuard;
import com.growthpilot.platform.scheduler.service.log.ExecutionLogRecorder;
import com.growthpilot.platform.scheduler.service.quota.QuotaTracker;
import com.growthpilot.platform.scheduler.service.retry.RetryController;
import com.growthpilot.platform.scheduler.service.retry.RetryDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the outstanding actions of one claimed target and settles its status. Each action draws
 * its own quota unit before the platform call; a refused unit skips that action only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngagementExecutor {

    private final QuotaTracker quotaTracker;
    private final RetryController retryController;
    private final ExecutionLogRecorder logRecorder;
    private final EngagementTargetStore targetStore;
    private final EngagementBurstGuard burstGuard;
    private final AuditPublisher auditPublisher;
    private final SchedulerProperties properties;

    public TargetResult execute(GrowthStrategy strategy, EngagementTarget target, PlatformSession session,
                                OffsetDateTime now) {
        if (strategy.isAvoided(target)) {
            log.info("Skipping target {}: {} is on the avoid list of strategy {}",
                    target.getId(), target.handle(), strategy.getId());
            return settle(strategy, target, TargetOutcome.SKIPPED, "Account is on the avoid list", now, 0, false);
        }

        List<ActionType> actions = requestedActions(strategy, target);
        boolean replyHeld = replyAwaitingApproval(strategy, target);
        if (actions.isEmpty()) {
            if (replyHeld) {
                return holdForApproval(target, 0);
            }
            TargetOutcome outcome = target.anyActionDone() ? TargetOutcome.COMPLETED : TargetOutcome.SKIPPED;
            return settle(strategy, target, outcome, "No applicable actions", now, 0, false);
        }

        LocalDate day = strategy.localDate(now);
        int performed = 0;
        boolean quotaRefused = false;
        PlatformClientException failure = null;

        for (ActionType action : actions) {
            QuotaAction quotaAction = action.quotaAction()
                    .orElseThrow(() -> new IllegalStateException("No quota bucket for " + action));
            if (!quotaTracker.tryConsume(strategy.getUserId(), quotaAction, day, strategy.dailyLimitFor(quotaAction))) {
                quotaRefused = true;
                auditPublisher.publish(AuditEventType.QUOTA_EXHAUSTED, strategy.getUserId(), strategy.getId(),
                        quotaAction, "Skipped " + action + " on target " + target.getId());
                continue;
            }
            try {
                String resultId = perform(session, action, target);
                logRecorder.recordEngagement(entry(strategy, target, action)
                        .success(true)
                        .replyTweetId(resultId)
                        .build(), day);
                target.markDone(action);
                burstGuard.record(strategy.getId(), quotaAction);
                performed++;
                log.debug("{} done for target {} of strategy {}", action, target.getId(), strategy.getId());
            } catch (PlatformClientException e) {
                log.warn("{} failed for target {} ({}, {}): {}", action, target.getId(),
                        e.getFailureClass(), e.getErrorCode(), e.getMessage());
                logRecorder.recordEngagement(entry(strategy, target, action)
                        .success(false)
                        .errorCode(e.getErrorCode())
                        .errorMessage(e.getMessage())
                        .build(), day);
                failure = e;
                break;
            }
        }

        if (failure != null) {
            return settleFailure(strategy, target, failure, now, performed);
        }
        if (quotaRefused) {
            return settleQuotaRefusal(strategy, target, now, performed);
        }
        if (replyHeld) {
            return holdForApproval(target, performed);
        }
        return settle(strategy, target, TargetOutcome.COMPLETED, null, now, performed, false);
    }

    private List<ActionType> requestedActions(GrowthStrategy strategy, EngagementTarget target) {
        return target.outstandingActions().stream()
                .filter(a -> a != ActionType.REPLY || Boolean.TRUE.equals(strategy.getAutoReplyEnabled()))
                .filter(a -> a != ActionType.REPLY || !needsApproval(strategy, target))
                .collect(Collectors.toList());
    }

    private boolean needsApproval(GrowthStrategy strategy, EngagementTarget target) {
        return Boolean.TRUE.equals(strategy.getRequireReplyApproval()) && !Boolean.TRUE.equals(target.getReplyApproved());
    }

    private boolean replyAwaitingApproval(GrowthStrategy strategy, EngagementTarget target) {
        return Boolean.TRUE.equals(strategy.getAutoReplyEnabled())
                && needsApproval(strategy, target)
                && target.outstandingActions().contains(ActionType.REPLY);
    }

    /** The other actions are settled; the target stays PENDING until its reply is approved. */
    private TargetResult holdForApproval(EngagementTarget target, int performed) {
        target.reschedule(target.getScheduledFor(), "Reply awaiting approval");
        targetStore.save(target);
        log.info("Target {} waits for reply approval after {} actions", target.getId(), performed);
        return TargetResult.of(TargetOutcome.AWAITING_APPROVAL, performed);
    }

    private String resolveFollowTarget(PlatformSession session, EngagementTarget target) {
        if (target.followTargetId() != null) {
            return target.followTargetId();
        }
        String accountId = session.lookupAccountId(target.handle());
        if (accountId == null) {
            throw new PlatformClientException(FailureClass.PERMANENT, "USER_NOT_FOUND",
                    "User not found: @" + target.handle());
        }
        target.resolveFollowTarget(accountId);
        return accountId;
    }

    private String perform(PlatformSession session, ActionType action, EngagementTarget target) {
        switch (action) {
            case FOLLOW -> session.follow(resolveFollowTarget(session, target));
            case LIKE -> session.like(target.getTweetId());
            case RETWEET -> session.retweet(target.getTweetId());
            case REPLY -> {
                return session.reply(target.getTweetId(), target.getReplyContent()).getTweetId();
            }
            default -> throw new IllegalArgumentException("Unsupported target action " + action);
        }
        return null;
    }

    private TargetResult settleFailure(GrowthStrategy strategy, EngagementTarget target,
                                       PlatformClientException failure, OffsetDateTime now, int performed) {
        String error = String.format("[%s] %s", failure.getErrorCode(), failure.getMessage());
        boolean rateLimited = failure.isRateLimited();
        if (failure.getFailureClass() == FailureClass.PERMANENT) {
            return settle(strategy, target, TargetOutcome.FAILED, error, now, performed, false);
        }

        RetryDecision decision = retryController
                .decide(target.getAttemptCount(), properties.getGrowth().getMaxActionRetries(), FailureClass.TRANSIENT)
                .withMinimumDelay(failure.getRetryAfter());
        if (!decision.isRetry()) {
            return settle(strategy, target, TargetOutcome.FAILED, error, now, performed, rateLimited);
        }
        target.setAttemptCount(target.getAttemptCount() + 1);
        target.reschedule(now.plus(decision.getDelay()), error);
        targetStore.save(target);
        log.info("Target {} will retry at {} (attempt {})", target.getId(), target.getScheduledFor(),
                target.getAttemptCount());
        return new TargetResult(TargetOutcome.RETRY_SCHEDULED, performed, rateLimited);
    }

    private TargetResult settleQuotaRefusal(GrowthStrategy strategy, EngagementTarget target,
                                            OffsetDateTime now, int performed) {
        if (properties.getGrowth().getQuotaExhaustedPolicy() == SchedulerProperties.QuotaExhaustedPolicy.DEFER) {
            target.reschedule(strategy.startOfNextLocalDay(now), "Daily quota reached");
            targetStore.save(target);
            log.info("Target {} deferred to {} by daily quota", target.getId(), target.getScheduledFor());
            return TargetResult.of(TargetOutcome.DEFERRED, performed);
        }
        TargetOutcome outcome = target.anyActionDone() ? TargetOutcome.COMPLETED : TargetOutcome.SKIPPED;
        return settle(strategy, target, outcome, "Daily quota reached", now, performed, false);
    }

    private TargetResult settle(GrowthStrategy strategy, EngagementTarget target, TargetOutcome outcome,
                                String reason, OffsetDateTime now, int performed, boolean rateLimited) {
        AuditEventType eventType;
        switch (outcome) {
            case COMPLETED -> {
                target.complete(now);
                eventType = AuditEventType.ENGAGEMENT_COMPLETED;
            }
            case FAILED -> {
                target.fail(reason, now);
                eventType = AuditEventType.ENGAGEMENT_FAILED;
            }
            case SKIPPED -> {
                target.skip(reason, now);
                eventType = AuditEventType.ENGAGEMENT_SKIPPED;
            }
            default -> throw new IllegalArgumentException("Not a final target outcome: " + outcome);
        }
        targetStore.save(target);
        auditPublisher.publish(eventType, strategy.getUserId(), target.getId(), target.getStatus(), reason);
        return new TargetResult(outcome, performed, rateLimited);
    }

    private EngagementLog.EngagementLogBuilder entry(GrowthStrategy strategy, EngagementTarget target, ActionType action) {
        return EngagementLog.builder()
                .strategyId(strategy.getId())
                .targetId(target.getId())
                .actionType(action)
                .platformUserId(action == ActionType.FOLLOW ? target.followTargetId() : null)
                .platformUsername(target.handle())
                .tweetId(target.getTweetId())
                .replyContent(action == ActionType.REPLY ? target.getReplyContent() : null);
    }
}
