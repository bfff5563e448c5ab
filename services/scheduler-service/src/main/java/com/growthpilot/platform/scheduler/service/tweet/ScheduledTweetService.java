package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.dto.ScheduledTweetResponse;
import com.growthpilot.platform.scheduler.dto.TweetExecutionResponse;
import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetExecutionLog;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import com.growthpilot.platform.scheduler.exception.ForbiddenOperationException;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.repository.TweetExecutionLogRepository;
import com.growthpilot.platform.scheduler.service.audit.AuditEventType;
import com.growthpilot.platform.scheduler.service.audit.AuditPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * User-facing operations on tweets that already exist: inspection, scheduling a draft, cancellation
 * and deletion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledTweetService {

    private final ScheduledTweetStore tweetStore;
    private final TweetExecutionLogRepository executionLogRepository;
    private final AuditPublisher auditPublisher;
    private final Clock clock;

    public ScheduledTweetResponse getTweet(UUID userId, UUID tweetId) {
        return mapToResponse(loadOwned(userId, tweetId));
    }

    public List<TweetExecutionResponse> getExecutions(UUID userId, UUID tweetId) {
        loadOwned(userId, tweetId);
        return executionLogRepository.findByScheduledTweetIdOrderByAttemptNumberAsc(tweetId)
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    public ScheduledTweetResponse schedule(UUID userId, UUID tweetId) {
        loadOwned(userId, tweetId);
        ScheduledTweet tweet = tweetStore.schedule(tweetId);
        log.info("Draft tweet {} scheduled for {}", tweetId, tweet.getScheduledFor());
        return mapToResponse(tweet);
    }

    /**
     * Cancel a tweet that has not started posting. A tweet in POSTING or in a terminal status is
     * left untouched and the call is rejected.
     */
    public ScheduledTweetResponse cancel(UUID userId, UUID tweetId) {
        ScheduledTweet tweet = loadOwned(userId, tweetId);
        if (!tweetStore.cancel(tweetId)) {
            ScheduledTweet current = tweetStore.get(tweetId);
            throw new IllegalStateTransitionException("ScheduledTweet", tweetId, current.getStatus(), TweetStatus.CANCELLED);
        }
        log.info("Cancelled tweet {} (was {})", tweetId, tweet.getStatus());
        auditPublisher.publish(AuditEventType.TWEET_CANCELLED, userId, tweetId, TweetStatus.CANCELLED, null);
        return mapToResponse(tweetStore.get(tweetId));
    }

    public void delete(UUID userId, UUID tweetId) {
        loadOwned(userId, tweetId);
        tweetStore.softDelete(tweetId, OffsetDateTime.now(clock));
        log.info("Soft-deleted tweet {} for user {}", tweetId, userId);
    }

    private ScheduledTweet loadOwned(UUID userId, UUID tweetId) {
        ScheduledTweet tweet = tweetStore.get(tweetId);
        if (!tweet.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Tweet " + tweetId + " belongs to another user");
        }
        return tweet;
    }

    private ScheduledTweetResponse mapToResponse(ScheduledTweet tweet) {
        return ScheduledTweetResponse.builder()
                .id(tweet.getId())
                .userId(tweet.getUserId())
                .content(tweet.getContent())
                .thread(tweet.getThread())
                .threadContents(tweet.getThreadContents())
                .mediaUrls(tweet.getMediaUrls())
                .scheduledFor(tweet.getScheduledFor())
                .timezone(tweet.getTimezone())
                .status(tweet.getStatus())
                .terminal(tweet.getStatus().isTerminal())
                .postedAt(tweet.getPostedAt())
                .platformTweetId(tweet.getPlatformTweetId())
                .platformThreadIds(tweet.getPlatformThreadIds())
                .retryCount(tweet.getRetryCount())
                .maxRetries(tweet.getMaxRetries())
                .lastError(tweet.getLastError())
                .lastAttemptAt(tweet.getLastAttemptAt())
                .createdAt(tweet.getCreatedAt())
                .build();
    }

    private TweetExecutionResponse mapToResponse(TweetExecutionLog entry) {
        return TweetExecutionResponse.builder()
                .id(entry.getId())
                .attemptNumber(entry.getAttemptNumber())
                .status(entry.getStatus())
                .success(entry.getSuccess())
                .startedAt(entry.getStartedAt())
                .completedAt(entry.getCompletedAt())
                .errorCode(entry.getErrorCode())
                .errorMessage(entry.getErrorMessage())
                .build();
    }
}
