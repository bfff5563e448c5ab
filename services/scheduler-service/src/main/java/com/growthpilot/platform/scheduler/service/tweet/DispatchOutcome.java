package com.growthpilot.platform.scheduler.service.tweet;

public enum DispatchOutcome {
    POSTED,
    RETRY_SCHEDULED,
    FAILED,
    DEFERRED_QUOTA,
    /** Another worker, a cancellation or claim recovery got there first. */
    LOST_RACE,
    ERROR
}
