package com.growthpilot.platform.scheduler.dto;

import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyResponse {
    private UUID id;
    private UUID userId;
    private String name;
    private StrategyStatus status;
    private OffsetDateTime startDate;
    private OffsetDateTime endDate;
    private String timezone;
    private Integer engagementHoursStart;
    private Integer engagementHoursEnd;
    private Integer totalFollows;
    private Integer totalUnfollows;
    private Integer totalLikes;
    private Integer totalRetweets;
    private Integer totalReplies;
    private Integer totalPosts;
    private Integer startingFollowers;
    private Integer currentFollowers;
    private Integer followersGained;
}
