package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.QuotaAction;
import lombok.*;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsageResponse {
    private UUID userId;
    private LocalDate date;
    private List<ActionUsage> actions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionUsage {
        private QuotaAction action;
        private int used;
        private int limit;
        private int remaining;
    }
}
