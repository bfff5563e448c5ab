package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "engagement_targets", indexes = {
        @Index(name = "idx_engagement_targets_pick", columnList = "strategy_id, status, scheduled_for")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementTarget {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "strategy_id", nullable = false)
    private UUID strategyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, length = 20)
    private TargetType targetType;

    // ACCOUNT targets
    @Column(name = "platform_user_id")
    private String platformUserId;

    @Column(name = "platform_username")
    private String platformUsername;

    @Column(name = "follower_count")
    private Integer followerCount;

    // TWEET targets
    @Column(name = "tweet_id")
    private String tweetId;

    @Column(name = "tweet_author")
    private String tweetAuthor;

    @Column(name = "tweet_author_id")
    private String tweetAuthorId;

    @Column(name = "tweet_content", columnDefinition = "TEXT")
    private String tweetContent;

    @Column(name = "should_follow")
    @Builder.Default
    private Boolean shouldFollow = false;

    @Column(name = "should_like")
    @Builder.Default
    private Boolean shouldLike = false;

    @Column(name = "should_retweet")
    @Builder.Default
    private Boolean shouldRetweet = false;

    @Column(name = "should_reply")
    @Builder.Default
    private Boolean shouldReply = false;

    @Column(name = "reply_content", columnDefinition = "TEXT")
    private String replyContent;

    @Column(name = "reply_approved")
    @Builder.Default
    private Boolean replyApproved = false;

    @Column(name = "follow_done")
    @Builder.Default
    private Boolean followDone = false;

    @Column(name = "like_done")
    @Builder.Default
    private Boolean likeDone = false;

    @Column(name = "retweet_done")
    @Builder.Default
    private Boolean retweetDone = false;

    @Column(name = "reply_done")
    @Builder.Default
    private Boolean replyDone = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private EngagementStatus status = EngagementStatus.PENDING;

    @Column(name = "scheduled_for")
    private OffsetDateTime scheduledFor;

    @Column(name = "executed_at")
    private OffsetDateTime executedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "relevance_score", nullable = false)
    @Builder.Default
    private Double relevanceScore = 0.5;

    @Column(nullable = false)
    @Builder.Default
    private Integer priority = 0;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "claim_token")
    private UUID claimToken;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void validateShape() {
        boolean hasAccount = platformUserId != null || platformUsername != null;
        boolean hasTweet = tweetId != null || tweetAuthor != null || tweetAuthorId != null || tweetContent != null;
        if (targetType == TargetType.ACCOUNT && (!hasAccount || hasTweet)) {
            throw new IllegalStateException("ACCOUNT target requires account fields only");
        }
        if (targetType == TargetType.TWEET && (tweetId == null || hasAccount)) {
            throw new IllegalStateException("TWEET target requires tweet fields only");
        }
    }

    /** Requested actions still outstanding, in execution order. */
    public List<ActionType> outstandingActions() {
        List<ActionType> actions = new ArrayList<>();
        if (Boolean.TRUE.equals(shouldFollow) && !Boolean.TRUE.equals(followDone)
                && (followTargetId() != null || handle() != null)) {
            actions.add(ActionType.FOLLOW);
        }
        if (targetType == TargetType.TWEET) {
            if (Boolean.TRUE.equals(shouldLike) && !Boolean.TRUE.equals(likeDone)) {
                actions.add(ActionType.LIKE);
            }
            if (Boolean.TRUE.equals(shouldRetweet) && !Boolean.TRUE.equals(retweetDone)) {
                actions.add(ActionType.RETWEET);
            }
            if (Boolean.TRUE.equals(shouldReply) && !Boolean.TRUE.equals(replyDone)
                    && replyContent != null && !replyContent.isBlank()) {
                actions.add(ActionType.REPLY);
            }
        }
        return actions;
    }

    public void markDone(ActionType action) {
        switch (action) {
            case FOLLOW -> followDone = true;
            case LIKE -> likeDone = true;
            case RETWEET -> retweetDone = true;
            case REPLY -> replyDone = true;
            default -> throw new IllegalArgumentException("Not a target action: " + action);
        }
    }

    public boolean anyActionDone() {
        return Boolean.TRUE.equals(followDone) || Boolean.TRUE.equals(likeDone)
                || Boolean.TRUE.equals(retweetDone) || Boolean.TRUE.equals(replyDone);
    }

    /** Account to follow: the account itself, or the author of a tweet target. */
    public String followTargetId() {
        return targetType == TargetType.ACCOUNT ? platformUserId : tweetAuthorId;
    }

    /** Store the account id looked up from the handle, so later actions and logs carry it. */
    public void resolveFollowTarget(String accountId) {
        if (targetType == TargetType.ACCOUNT) {
            this.platformUserId = accountId;
        } else {
            this.tweetAuthorId = accountId;
        }
    }

    /** Handle checked against the strategy's avoid list. */
    public String handle() {
        return targetType == TargetType.ACCOUNT ? platformUsername : tweetAuthor;
    }

    public void transitionTo(EngagementStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Target " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public void complete(OffsetDateTime at) {
        transitionTo(EngagementStatus.COMPLETED);
        this.executedAt = at;
        this.errorMessage = null;
        releaseClaim();
    }

    public void fail(String error, OffsetDateTime at) {
        transitionTo(EngagementStatus.FAILED);
        this.executedAt = at;
        this.errorMessage = error;
        releaseClaim();
    }

    public void skip(String reason, OffsetDateTime at) {
        transitionTo(EngagementStatus.SKIPPED);
        this.executedAt = at;
        this.errorMessage = reason;
        releaseClaim();
    }

    /** Leaves the target PENDING for a later cycle. */
    public void reschedule(OffsetDateTime at, String reason) {
        this.scheduledFor = at;
        this.errorMessage = reason;
        releaseClaim();
    }

    public void releaseClaim() {
        this.claimToken = null;
        this.claimedAt = null;
    }
}
