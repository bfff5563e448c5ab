package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.TweetStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TweetExecutionResponse {
    private UUID id;
    private Integer attemptNumber;
    private TweetStatus status;
    private Boolean success;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String errorCode;
    private String errorMessage;
}
