package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "daily_progress", uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_progress_strategy_date", columnNames = {"strategy_id", "progress_date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "strategy_id", nullable = false)
    private UUID strategyId;

    @Column(name = "progress_date", nullable = false)
    private LocalDate progressDate;

    @Column(name = "follows_done", nullable = false)
    @Builder.Default
    private Integer followsDone = 0;

    @Column(name = "unfollows_done", nullable = false)
    @Builder.Default
    private Integer unfollowsDone = 0;

    @Column(name = "likes_done", nullable = false)
    @Builder.Default
    private Integer likesDone = 0;

    @Column(name = "retweets_done", nullable = false)
    @Builder.Default
    private Integer retweetsDone = 0;

    @Column(name = "replies_done", nullable = false)
    @Builder.Default
    private Integer repliesDone = 0;

    @Column(name = "posts_done", nullable = false)
    @Builder.Default
    private Integer postsDone = 0;

    @Column(name = "follower_count")
    private Integer followerCount;

    @Column(name = "following_count")
    private Integer followingCount;

    @Column(name = "engagement_rate")
    private Double engagementRate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public int countFor(QuotaAction action) {
        return switch (action) {
            case FOLLOW -> followsDone;
            case UNFOLLOW -> unfollowsDone;
            case LIKE -> likesDone;
            case RETWEET -> retweetsDone;
            case REPLY -> repliesDone;
            case POST -> postsDone;
        };
    }
}
