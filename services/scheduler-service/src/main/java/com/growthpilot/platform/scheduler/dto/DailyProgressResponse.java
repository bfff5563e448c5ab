package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyProgressResponse {
    private LocalDate date;
    private Integer followsDone;
    private Integer unfollowsDone;
    private Integer likesDone;
    private Integer retweetsDone;
    private Integer repliesDone;
    private Integer postsDone;
    private Integer followerCount;
    private Integer followingCount;
}
