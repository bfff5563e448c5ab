package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.client.PlatformClient;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.dto.GrowthCycleReport;
import com.growthpilot.platform.scheduler.dto.StrategyCycleResult;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.service.guard.EngagementBurstGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One pass over every ACTIVE strategy. A failure in one strategy or one target is logged and the
 * pass moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrowthStrategyScheduler {

    private final GrowthStrategyStore strategyStore;
    private final EngagementTargetStore targetStore;
    private final EngagementExecutor engagementExecutor;
    private final StrategyLifecycleService lifecycleService;
    private final EngagementBurstGuard burstGuard;
    private final PlatformClient platformClient;
    private final SchedulerProperties properties;
    private final Clock clock;

    public GrowthCycleReport runCycle() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<StrategyCycleResult> results = new ArrayList<>();

        for (GrowthStrategy strategy : strategyStore.findActive()) {
            try {
                results.add(processStrategy(strategy, now));
            } catch (RuntimeException e) {
                log.error("Growth cycle failed for strategy {}", strategy.getId(), e);
                StrategyCycleResult failed = StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.ERROR);
                failed.setDetail(e.getMessage());
                results.add(failed);
            }
        }

        return GrowthCycleReport.builder()
                .startedAt(now)
                .finishedAt(OffsetDateTime.now(clock))
                .strategies(results)
                .build();
    }

    StrategyCycleResult processStrategy(GrowthStrategy strategy, OffsetDateTime now) {
        if (strategy.hasEnded(now)) {
            lifecycleService.completeExpired(strategy);
            return StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.COMPLETED_STRATEGY);
        }
        if (!strategy.hasStarted(now)) {
            return StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.NOT_STARTED);
        }
        if (!strategy.isWithinEngagementHours(now)) {
            log.debug("Strategy {} outside engagement hours {}-{} ({})", strategy.getId(),
                    strategy.getEngagementHoursStart(), strategy.getEngagementHoursEnd(), strategy.getTimezone());
            return StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.OUTSIDE_HOURS);
        }
        if (burstGuard.isSaturated(strategy.getId())) {
            return StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.BURST_LIMITED);
        }

        List<EngagementTarget> candidates = targetStore.findCandidates(strategy, now,
                properties.getGrowth().getBatchSize());
        if (candidates.isEmpty()) {
            return StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.NO_WORK);
        }

        StrategyCycleResult result = StrategyCycleResult.of(strategy.getId(), StrategyCycleResult.Status.PROCESSED);
        try (PlatformSession session = platformClient.openSession(strategy.getUserId())) {
            for (EngagementTarget candidate : candidates) {
                Optional<EngagementTarget> claimed = targetStore.claim(candidate, now);
                if (claimed.isEmpty()) {
                    result.setLostRace(result.getLostRace() + 1);
                    continue;
                }
                TargetResult targetResult;
                try {
                    targetResult = engagementExecutor.execute(strategy, claimed.get(), session, now);
                } catch (OptimisticLockingFailureException e) {
                    log.warn("Target {} changed concurrently; leaving it for a later cycle", candidate.getId());
                    result.setLostRace(result.getLostRace() + 1);
                    continue;
                } catch (RuntimeException e) {
                    log.error("Unexpected error on target {} of strategy {}", candidate.getId(), strategy.getId(), e);
                    result.setErrors(result.getErrors() + 1);
                    continue;
                }
                tally(result, targetResult);
                if (targetResult.isRateLimited() && properties.getGrowth().isStopOnRateLimit()) {
                    log.warn("Platform rate limit hit for strategy {}; stopping this cycle", strategy.getId());
                    result.setStatus(StrategyCycleResult.Status.RATE_LIMITED);
                    break;
                }
            }
        } catch (PlatformClientException e) {
            log.warn("Could not open platform session for strategy {}: {}", strategy.getId(), e.getMessage());
            result.setStatus(StrategyCycleResult.Status.SESSION_UNAVAILABLE);
            result.setDetail(e.getMessage());
        }

        log.info("Strategy {} cycle: completed={}, failed={}, skipped={}, retrying={}, deferred={}",
                strategy.getId(), result.getCompleted(), result.getFailed(), result.getSkipped(),
                result.getRetryScheduled(), result.getDeferred());
        return result;
    }

    private void tally(StrategyCycleResult result, TargetResult targetResult) {
        switch (targetResult.getOutcome()) {
            case COMPLETED -> result.setCompleted(result.getCompleted() + 1);
            case FAILED -> result.setFailed(result.getFailed() + 1);
            case SKIPPED -> result.setSkipped(result.getSkipped() + 1);
            case RETRY_SCHEDULED -> result.setRetryScheduled(result.getRetryScheduled() + 1);
            case DEFERRED -> result.setDeferred(result.getDeferred() + 1);
            case AWAITING_APPROVAL -> result.setAwaitingApproval(result.getAwaitingApproval() + 1);
        }
    }
}
