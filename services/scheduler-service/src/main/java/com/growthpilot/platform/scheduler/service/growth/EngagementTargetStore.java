package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.entity.EngagementStatus;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.exception.ResourceNotFoundException;
import com.growthpilot.platform.scheduler.repository.EngagementTargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementTargetStore {

    private final EngagementTargetRepository targetRepository;
    private final SchedulerProperties properties;

    /**
     * PENDING targets that are due, unclaimed (or whose claim expired) and have something to run.
     * A target whose only outstanding action is an unapproved reply is left out. Highest priority
     * first; ties are broken by relevance, then schedule, then id.
     */
    @Transactional(readOnly = true)
    public List<EngagementTarget> findCandidates(GrowthStrategy strategy, OffsetDateTime now, int limit) {
        return targetRepository.findCandidates(
                strategy.getId(),
                EngagementStatus.PENDING,
                now,
                staleBefore(now),
                Boolean.TRUE.equals(strategy.getRequireReplyApproval()),
                PageRequest.of(0, limit));
    }

    @Transactional
    public Optional<EngagementTarget> claim(EngagementTarget candidate, OffsetDateTime now) {
        int updated = targetRepository.claim(candidate.getId(), UUID.randomUUID(), now,
                EngagementStatus.PENDING, staleBefore(now));
        if (updated == 0) {
            log.debug("Lost claim on target {}", candidate.getId());
            return Optional.empty();
        }
        return targetRepository.findById(candidate.getId());
    }

    @Transactional
    public EngagementTarget save(EngagementTarget target) {
        return targetRepository.saveAndFlush(target);
    }

    @Transactional(readOnly = true)
    public long count(UUID strategyId, EngagementStatus status) {
        return targetRepository.countByStrategyIdAndStatus(strategyId, status);
    }

    @Transactional
    public EngagementTarget approveReply(UUID strategyId, UUID targetId) {
        EngagementTarget target = targetRepository.findById(targetId)
                .filter(t -> t.getStrategyId().equals(strategyId))
                .orElseThrow(() -> new ResourceNotFoundException("EngagementTarget", targetId));
        if (!Boolean.TRUE.equals(target.getShouldReply()) || target.getReplyContent() == null) {
            throw new IllegalStateTransitionException("Target " + targetId + " has no reply to approve");
        }
        if (target.getStatus() != EngagementStatus.PENDING) {
            throw new IllegalStateTransitionException("Target " + targetId + " is already " + target.getStatus());
        }
        target.setReplyApproved(true);
        log.info("Reply approved for target {}", targetId);
        return targetRepository.save(target);
    }

    private OffsetDateTime staleBefore(OffsetDateTime now) {
        return now.minus(properties.getGrowth().getClaimTimeout());
    }
}
