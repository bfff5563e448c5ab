package com.growthpilot.platform.scheduler.service.audit;

public enum AuditEventType {
    TWEET_POSTED,
    TWEET_RETRY_SCHEDULED,
    TWEET_FAILED,
    TWEET_CANCELLED,
    TWEET_DEFERRED_QUOTA,
    ENGAGEMENT_COMPLETED,
    ENGAGEMENT_FAILED,
    ENGAGEMENT_SKIPPED,
    ENGAGEMENT_REVERTED,
    QUOTA_EXHAUSTED,
    STRATEGY_STATUS_CHANGED;

    public String routingKey() {
        return "scheduler." + name().toLowerCase().replace('_', '.');
    }
}
