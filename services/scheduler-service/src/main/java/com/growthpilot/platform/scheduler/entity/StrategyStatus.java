package com.growthpilot.platform.scheduler.entity;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum StrategyStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    private static final Map<StrategyStatus, Set<StrategyStatus>> TRANSITIONS = new EnumMap<>(StrategyStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(ACTIVE, CANCELLED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(PAUSED, COMPLETED, CANCELLED));
        TRANSITIONS.put(PAUSED, EnumSet.of(ACTIVE, COMPLETED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(StrategyStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(StrategyStatus.class));
    }

    public boolean canTransitionTo(StrategyStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
