package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.EngagementStatus;
import com.growthpilot.platform.scheduler.entity.TargetType;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementTargetResponse {
    private UUID id;
    private UUID strategyId;
    private TargetType targetType;
    private String handle;
    private String tweetId;
    private EngagementStatus status;
    private String replyContent;
    private Boolean replyApproved;
    private OffsetDateTime scheduledFor;
    private OffsetDateTime executedAt;
    private String errorMessage;
}
