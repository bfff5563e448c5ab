package com.growthpilot.platform.scheduler.dto;

import lombok.*;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResult {
    private boolean success;
    private String tweetId;
    @Builder.Default
    private List<String> threadIds = new ArrayList<>();
    private String errorCode;
    private String errorMessage;
    private String rawResponse;

    public static PostResult posted(String tweetId, List<String> threadIds) {
        return PostResult.builder()
                .success(true)
                .tweetId(tweetId)
                .threadIds(threadIds != null ? threadIds : new ArrayList<>())
                .build();
    }
}
