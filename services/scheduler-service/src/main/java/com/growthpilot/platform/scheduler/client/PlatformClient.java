package com.growthpilot.platform.scheduler.client;

import java.util.UUID;

/**
 * Entry point to the social platform. Callers open one session per dispatch attempt or strategy
 * cycle and close it when done; sessions are never shared between users.
 */
public interface PlatformClient {

    PlatformSession openSession(UUID userId);
}
