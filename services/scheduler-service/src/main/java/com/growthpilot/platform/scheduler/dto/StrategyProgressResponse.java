package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyProgressResponse {
    private StrategyResponse strategy;
    private DailyProgressResponse today;
    private List<DailyProgressResponse> history;
    private Long pendingTargets;
    private Long completedTargets;
    private Long failedTargets;
    private Long skippedTargets;
}
