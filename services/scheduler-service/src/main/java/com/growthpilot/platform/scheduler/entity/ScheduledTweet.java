package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "scheduled_tweets", indexes = {
        @Index(name = "idx_scheduled_tweets_due", columnList = "status, scheduled_for"),
        @Index(name = "idx_scheduled_tweets_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTweet {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_urls")
    @Builder.Default
    private List<String> mediaUrls = new ArrayList<>();

    @Column(name = "is_thread")
    @Builder.Default
    private Boolean thread = false;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "thread_contents")
    @Builder.Default
    private List<String> threadContents = new ArrayList<>();

    @Column(name = "scheduled_for", nullable = false)
    private OffsetDateTime scheduledFor;

    @Column(nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private TweetStatus status = TweetStatus.PENDING;

    @Column(name = "posted_at")
    private OffsetDateTime postedAt;

    @Column(name = "platform_tweet_id")
    private String platformTweetId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "platform_thread_ids")
    @Builder.Default
    private List<String> platformThreadIds = new ArrayList<>();

    @Column(name = "retry_count", nullable = false)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 3;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_attempt_at")
    private OffsetDateTime lastAttemptAt;

    @Column(name = "claim_token")
    private UUID claimToken;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public void transitionTo(TweetStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Tweet " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public boolean isThread() {
        return Boolean.TRUE.equals(thread);
    }

    /** Parts to publish in order; a single tweet is a one-element list. */
    public List<String> segments() {
        if (isThread()) {
            return threadContents != null ? new ArrayList<>(threadContents) : new ArrayList<>();
        }
        List<String> single = new ArrayList<>();
        single.add(content);
        return single;
    }

    public void markPosted(String tweetId, List<String> threadIds, OffsetDateTime at) {
        transitionTo(TweetStatus.POSTED);
        this.platformTweetId = tweetId;
        this.platformThreadIds = threadIds != null ? new ArrayList<>(threadIds) : new ArrayList<>();
        this.postedAt = at;
        this.lastError = null;
        releaseClaim();
    }

    public void markRetrying(String error, OffsetDateTime nextAttemptAt) {
        transitionTo(TweetStatus.RETRYING);
        this.retryCount = retryCount + 1;
        this.lastError = error;
        this.scheduledFor = nextAttemptAt;
        releaseClaim();
    }

    public void markFailed(String error) {
        transitionTo(TweetStatus.FAILED);
        this.lastError = error;
        releaseClaim();
    }

    public void cancel() {
        transitionTo(TweetStatus.CANCELLED);
        releaseClaim();
    }

    public void promote() {
        transitionTo(TweetStatus.PENDING);
    }

    private void releaseClaim() {
        this.claimToken = null;
        this.claimedAt = null;
    }
}
