package com.growthpilot.platform.scheduler.client;

public enum FailureClass {
    /** Worth retrying later: timeouts, connection errors, throttling, server errors. */
    TRANSIENT,
    /** Retrying cannot help: rejected content, missing resource, revoked authorization. */
    PERMANENT
}
