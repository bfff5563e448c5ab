package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Platform-wide daily action counters for one user, shared by every strategy and the tweet dispatcher.
 */
@Entity
@Table(name = "rate_limit_trackers", uniqueConstraints = {
        @UniqueConstraint(name = "uk_rate_limit_user_date", columnNames = {"user_id", "tracker_date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitTracker {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "tracker_date", nullable = false)
    private LocalDate trackerDate;

    @Column(name = "follows_count", nullable = false)
    @Builder.Default
    private Integer followsCount = 0;

    @Column(name = "unfollows_count", nullable = false)
    @Builder.Default
    private Integer unfollowsCount = 0;

    @Column(name = "likes_count", nullable = false)
    @Builder.Default
    private Integer likesCount = 0;

    @Column(name = "retweets_count", nullable = false)
    @Builder.Default
    private Integer retweetsCount = 0;

    @Column(name = "replies_count", nullable = false)
    @Builder.Default
    private Integer repliesCount = 0;

    @Column(name = "posts_count", nullable = false)
    @Builder.Default
    private Integer postsCount = 0;

    @Column(name = "last_reset")
    private OffsetDateTime lastReset;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public int countFor(QuotaAction action) {
        return switch (action) {
            case FOLLOW -> followsCount;
            case UNFOLLOW -> unfollowsCount;
            case LIKE -> likesCount;
            case RETWEET -> retweetsCount;
            case REPLY -> repliesCount;
            case POST -> postsCount;
        };
    }
}
