package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.ActionType;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementLogResponse {
    private UUID id;
    private UUID targetId;
    private ActionType actionType;
    private String platformUserId;
    private String tweetId;
    private Boolean success;
    private String errorCode;
    private String errorMessage;
    private OffsetDateTime createdAt;
}
