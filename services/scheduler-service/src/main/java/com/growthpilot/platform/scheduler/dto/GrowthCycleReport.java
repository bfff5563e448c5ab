package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrowthCycleReport {
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    @Builder.Default
    private List<StrategyCycleResult> strategies = new ArrayList<>();
}
