package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.TweetStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTweetResponse {
    private UUID id;
    private UUID userId;
    private String content;
    private Boolean thread;
    private List<String> threadContents;
    private List<String> mediaUrls;
    private OffsetDateTime scheduledFor;
    private String timezone;
    private TweetStatus status;
    private boolean terminal;
    private OffsetDateTime postedAt;
    private String platformTweetId;
    private List<String> platformThreadIds;
    private Integer retryCount;
    private Integer maxRetries;
    private String lastError;
    private OffsetDateTime lastAttemptAt;
    private OffsetDateTime createdAt;
}
