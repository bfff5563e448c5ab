package com.growthpilot.platform.scheduler.entity;

public enum EngagementStatus {
    PENDING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean canTransitionTo(EngagementStatus next) {
        return this == PENDING && next != PENDING;
    }
}
