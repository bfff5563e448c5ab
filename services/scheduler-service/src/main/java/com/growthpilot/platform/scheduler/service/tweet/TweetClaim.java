package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a tweet taken when the dispatcher won the claim. Only the holder of {@link #token}
 * may finalize or release the row.
 */
@Getter
@Builder
@ToString(exclude = "segments")
public class TweetClaim {

    private final UUID tweetId;
    private final UUID userId;
    private final UUID token;
    private final TweetStatus previousStatus;
    private final int retryCount;
    private final int maxRetries;
    private final List<String> segments;
    private final List<String> mediaUrls;
    private final boolean thread;
    private final String timezone;
    private final OffsetDateTime claimedAt;

    public static TweetClaim of(ScheduledTweet tweet, TweetStatus previousStatus) {
        return TweetClaim.builder()
                .tweetId(tweet.getId())
                .userId(tweet.getUserId())
                .token(tweet.getClaimToken())
                .previousStatus(previousStatus)
                .retryCount(tweet.getRetryCount())
                .maxRetries(tweet.getMaxRetries())
                .segments(tweet.segments())
                .mediaUrls(tweet.getMediaUrls() != null ? List.copyOf(tweet.getMediaUrls()) : List.of())
                .thread(tweet.isThread())
                .timezone(tweet.getTimezone())
                .claimedAt(tweet.getClaimedAt())
                .build();
    }

    public int getAttemptNumber() {
        return retryCount + 1;
    }

    public ZoneId zone() {
        return ZoneId.of(timezone != null ? timezone : "UTC");
    }
}
