package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyCycleResult {
    private UUID strategyId;
    private Status status;
    private int completed;
    private int failed;
    private int skipped;
    private int retryScheduled;
    private int deferred;
    private int awaitingApproval;
    private int lostRace;
    private int errors;
    private String detail;

    public enum Status {
        PROCESSED,
        COMPLETED_STRATEGY,
        NOT_STARTED,
        OUTSIDE_HOURS,
        BURST_LIMITED,
        NO_WORK,
        RATE_LIMITED,
        SESSION_UNAVAILABLE,
        ERROR
    }

    public static StrategyCycleResult of(UUID strategyId, Status status) {
        return StrategyCycleResult.builder().strategyId(strategyId).status(status).build();
    }
}
