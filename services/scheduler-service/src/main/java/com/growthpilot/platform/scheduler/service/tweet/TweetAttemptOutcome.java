package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.client.FailureClass;
import com.growthpilot.platform.scheduler.dto.PostResult;
import com.growthpilot.platform.scheduler.service.retry.RetryDecision;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.List;

@Getter
@Builder
@ToString
public class TweetAttemptOutcome {

    private final boolean success;
    private final String platformTweetId;
    private final List<String> threadIds;
    private final String platformResponse;
    private final FailureClass failureClass;
    private final String errorCode;
    private final String errorMessage;
    private final RetryDecision decision;
    private final OffsetDateTime nextAttemptAt;
    private final OffsetDateTime startedAt;
    private final OffsetDateTime completedAt;

    public static TweetAttemptOutcome posted(PostResult result, OffsetDateTime startedAt, OffsetDateTime completedAt) {
        return TweetAttemptOutcome.builder()
                .success(true)
                .platformTweetId(result.getTweetId())
                .threadIds(result.getThreadIds())
                .platformResponse(result.getRawResponse())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    public static TweetAttemptOutcome failed(FailureClass failureClass, String errorCode, String errorMessage,
                                             RetryDecision decision, OffsetDateTime startedAt,
                                             OffsetDateTime completedAt) {
        return TweetAttemptOutcome.builder()
                .success(false)
                .failureClass(failureClass)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .decision(decision)
                .nextAttemptAt(decision.isRetry() ? completedAt.plus(decision.getDelay()) : null)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    public boolean willRetry() {
        return !success && decision != null && decision.isRetry();
    }

    /** Error text stored on the tweet itself. */
    public String describeError() {
        return String.format("[%s] %s", errorCode, errorMessage);
    }
}
