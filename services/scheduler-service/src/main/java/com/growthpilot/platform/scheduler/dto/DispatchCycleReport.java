package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchCycleReport {
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private int due;
    private int recoveredClaims;
    private int posted;
    private int retryScheduled;
    private int failed;
    private int deferredForQuota;
    private int lostRace;
    private int errors;
}
