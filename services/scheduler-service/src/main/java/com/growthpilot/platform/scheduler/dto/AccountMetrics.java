package com.growthpilot.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountMetrics {
    private Integer followersCount;
    private Integer followingCount;
    private Integer tweetCount;
}
