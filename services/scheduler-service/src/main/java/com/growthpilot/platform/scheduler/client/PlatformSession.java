package com.growthpilot.platform.scheduler.client;

import com.growthpilot.platform.scheduler.dto.AccountMetrics;
import com.growthpilot.platform.scheduler.dto.PostResult;

import java.util.List;

/**
 * Authenticated, user-scoped view of the platform. Every method throws
 * {@link PlatformClientException} on failure; using a closed session throws {@link IllegalStateException}.
 */
public interface PlatformSession extends AutoCloseable {

    /** Publish a single tweet. */
    PostResult postTweet(String text, List<String> mediaUrls);

    /** Publish segments as a reply chain; media is attached to the first segment. */
    PostResult postThread(List<String> segments, List<String> mediaUrls);

    PostResult reply(String tweetId, String text);

    /** Account id for a handle, or {@code null} when the platform knows no such user. */
    String lookupAccountId(String username);

    void follow(String accountId);

    void unfollow(String accountId);

    void like(String tweetId);

    void unlike(String tweetId);

    void retweet(String tweetId);

    void unretweet(String tweetId);

    AccountMetrics accountMetrics();

    @Override
    void close();
}
