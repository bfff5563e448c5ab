package com.growthpilot.platform.scheduler.entity;

/**
 * Rate-limited action buckets tracked per user per calendar day.
 * Retweets and replies are also platform posts and count against {@link #POST} as well.
 */
public enum QuotaAction {
    FOLLOW,
    UNFOLLOW,
    LIKE,
    RETWEET,
    REPLY,
    POST;

    public boolean countsAsPost() {
        return this == RETWEET || this == REPLY;
    }
}
