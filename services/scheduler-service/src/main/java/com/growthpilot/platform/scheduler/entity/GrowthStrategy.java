package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "growth_strategies", indexes = {
        @Index(name = "idx_growth_strategies_status", columnList = "status"),
        @Index(name = "idx_growth_strategies_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrowthStrategy {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private StrategyStatus status = StrategyStatus.DRAFT;

    @Column(name = "start_date")
    private OffsetDateTime startDate;

    @Column(name = "end_date")
    private OffsetDateTime endDate;

    @Column(name = "daily_follows", nullable = false)
    @Builder.Default
    private Integer dailyFollows = 100;

    @Column(name = "daily_unfollows", nullable = false)
    @Builder.Default
    private Integer dailyUnfollows = 50;

    @Column(name = "daily_likes", nullable = false)
    @Builder.Default
    private Integer dailyLikes = 200;

    @Column(name = "daily_retweets", nullable = false)
    @Builder.Default
    private Integer dailyRetweets = 10;

    @Column(name = "daily_replies", nullable = false)
    @Builder.Default
    private Integer dailyReplies = 20;

    @Column(name = "daily_posts", nullable = false)
    @Builder.Default
    private Integer dailyPosts = 5;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "niche_keywords")
    @Builder.Default
    private List<String> nicheKeywords = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "target_accounts")
    @Builder.Default
    private List<String> targetAccounts = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "avoid_accounts")
    @Builder.Default
    private List<String> avoidAccounts = new ArrayList<>();

    @Column(name = "engagement_hours_start", nullable = false)
    @Builder.Default
    private Integer engagementHoursStart = 9;

    @Column(name = "engagement_hours_end", nullable = false)
    @Builder.Default
    private Integer engagementHoursEnd = 21;

    @Column(nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "auto_reply_enabled")
    @Builder.Default
    private Boolean autoReplyEnabled = true;

    @Column(name = "require_reply_approval")
    @Builder.Default
    private Boolean requireReplyApproval = false;

    @Column(name = "total_follows", nullable = false)
    @Builder.Default
    private Integer totalFollows = 0;

    @Column(name = "total_unfollows", nullable = false)
    @Builder.Default
    private Integer totalUnfollows = 0;

    @Column(name = "total_likes", nullable = false)
    @Builder.Default
    private Integer totalLikes = 0;

    @Column(name = "total_retweets", nullable = false)
    @Builder.Default
    private Integer totalRetweets = 0;

    @Column(name = "total_replies", nullable = false)
    @Builder.Default
    private Integer totalReplies = 0;

    @Column(name = "total_posts", nullable = false)
    @Builder.Default
    private Integer totalPosts = 0;

    @Column(name = "starting_followers")
    private Integer startingFollowers;

    @Column(name = "current_followers")
    private Integer currentFollowers;

    @Column(name = "followers_gained", nullable = false)
    @Builder.Default
    private Integer followersGained = 0;

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

    public void transitionTo(StrategyStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Strategy " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public LocalDate localDate(OffsetDateTime instant) {
        return instant.atZoneSameInstant(zone()).toLocalDate();
    }

    public OffsetDateTime startOfNextLocalDay(OffsetDateTime instant) {
        return localDate(instant).plusDays(1).atStartOfDay(zone()).toOffsetDateTime();
    }

    /**
     * Start hour inclusive, end hour exclusive. A window whose start is after its end wraps
     * midnight; equal bounds mean the whole day.
     */
    public boolean isWithinEngagementHours(OffsetDateTime instant) {
        ZonedDateTime local = instant.atZoneSameInstant(zone());
        int hour = local.toLocalTime().getHour();
        int start = engagementHoursStart;
        int end = engagementHoursEnd;
        if (start == end) {
            return true;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    public boolean hasStarted(OffsetDateTime now) {
        return startDate == null || !now.isBefore(startDate);
    }

    public boolean hasEnded(OffsetDateTime now) {
        return endDate != null && now.isAfter(endDate);
    }

    /** Avoid-list entries may name an account by handle or by platform id. */
    public boolean isAvoided(EngagementTarget target) {
        return isAvoided(target.handle()) || isAvoided(target.followTargetId());
    }

    public boolean isAvoided(String account) {
        if (account == null || avoidAccounts == null) {
            return false;
        }
        String normalized = normalizeHandle(account);
        return avoidAccounts.stream()
                .filter(Objects::nonNull)
                .anyMatch(a -> normalizeHandle(a).equals(normalized));
    }

    public int dailyLimitFor(QuotaAction action) {
        return switch (action) {
            case FOLLOW -> dailyFollows;
            case UNFOLLOW -> dailyUnfollows;
            case LIKE -> dailyLikes;
            case RETWEET -> dailyRetweets;
            case REPLY -> dailyReplies;
            case POST -> dailyPosts;
        };
    }

    public void recordFollowerCount(int followers) {
        if (startingFollowers == null) {
            startingFollowers = followers;
        }
        currentFollowers = followers;
        followersGained = followers - startingFollowers;
    }

    public static String normalizeHandle(String handle) {
        String trimmed = handle.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
