package com.growthpilot.platform.scheduler.service.growth;

import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import com.growthpilot.platform.scheduler.exception.ForbiddenOperationException;
import com.growthpilot.platform.scheduler.exception.ResourceNotFoundException;
import com.growthpilot.platform.scheduler.repository.DailyProgressRepository;
import com.growthpilot.platform.scheduler.repository.EngagementLogRepository;
import com.growthpilot.platform.scheduler.repository.EngagementTargetRepository;
import com.growthpilot.platform.scheduler.repository.GrowthStrategyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class GrowthStrategyStore {

    private final GrowthStrategyRepository strategyRepository;
    private final EngagementTargetRepository targetRepository;
    private final EngagementLogRepository engagementLogRepository;
    private final DailyProgressRepository progressRepository;

    @Transactional(readOnly = true)
    public List<GrowthStrategy> findActive() {
        return strategyRepository.findByStatus(StrategyStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<GrowthStrategy> findByUser(UUID userId) {
        return strategyRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public GrowthStrategy get(UUID strategyId) {
        return strategyRepository.findByIdAndDeletedAtIsNull(strategyId)
                .orElseThrow(() -> new ResourceNotFoundException("GrowthStrategy", strategyId));
    }

    @Transactional(readOnly = true)
    public GrowthStrategy getOwned(UUID userId, UUID strategyId) {
        GrowthStrategy strategy = get(strategyId);
        if (!strategy.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Strategy " + strategyId + " belongs to another user");
        }
        return strategy;
    }

    @Transactional
    public GrowthStrategy save(GrowthStrategy strategy) {
        return strategyRepository.saveAndFlush(strategy);
    }

    /**
     * Remove a strategy and everything it owns, children first.
     */
    @Transactional
    public void deleteStrategy(UUID strategyId) {
        long logs = engagementLogRepository.deleteByStrategyId(strategyId);
        int progress = progressRepository.deleteByStrategyId(strategyId);
        int targets = targetRepository.deleteByStrategyId(strategyId);
        strategyRepository.deleteById(strategyId);
        log.info("Deleted strategy {} with {} targets, {} logs, {} progress rows",
                strategyId, targets, logs, progress);
    }
}
