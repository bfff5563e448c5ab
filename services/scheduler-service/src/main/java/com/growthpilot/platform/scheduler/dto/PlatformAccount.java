package com.growthpilot.platform.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformAccount {
    private String id;
    private String username;
    private Integer followersCount;
}
