package com.growthpilot.platform.scheduler.service.growth;

public enum TargetOutcome {
    COMPLETED,
    FAILED,
    SKIPPED,
    /** Transient failure; the target stays PENDING until its backoff elapses. */
    RETRY_SCHEDULED,
    /** Quota refused some actions; the target stays PENDING until the next local day. */
    DEFERRED,
    /** Every other action is done; the reply waits for approval and the target stays PENDING. */
    AWAITING_APPROVAL
}
