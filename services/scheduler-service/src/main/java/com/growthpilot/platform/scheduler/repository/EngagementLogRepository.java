package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.UUID;

public interface EngagementLogRepository extends JpaRepository<EngagementLog, UUID> {

    List<EngagementLog> findByStrategyIdOrderByCreatedAtAsc(UUID strategyId);

    boolean existsByTargetIdAndActionTypeAndSuccessTrue(UUID targetId, ActionType actionType);

    long countByStrategyIdAndActionTypeAndSuccessTrue(UUID strategyId, ActionType actionType);

    // Derived delete removes rows one by one, which Hibernate allows for @Immutable entities.
    long deleteByStrategyId(UUID strategyId);
}
