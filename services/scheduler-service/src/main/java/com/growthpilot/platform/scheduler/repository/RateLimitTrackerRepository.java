package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.RateLimitTracker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Every increment is a single conditional UPDATE; the affected-row count says whether a unit was granted.
 */
public interface RateLimitTrackerRepository extends JpaRepository<RateLimitTracker, UUID> {

    Optional<RateLimitTracker> findByUserIdAndTrackerDate(UUID userId, LocalDate trackerDate);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.followsCount = r.followsCount + 1 " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.followsCount < :limit")
    int consumeFollow(@Param("userId") UUID userId, @Param("date") LocalDate date, @Param("limit") int limit);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.unfollowsCount = r.unfollowsCount + 1 " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.unfollowsCount < :limit")
    int consumeUnfollow(@Param("userId") UUID userId, @Param("date") LocalDate date, @Param("limit") int limit);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.likesCount = r.likesCount + 1 " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.likesCount < :limit")
    int consumeLike(@Param("userId") UUID userId, @Param("date") LocalDate date, @Param("limit") int limit);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.retweetsCount = r.retweetsCount + 1, r.postsCount = r.postsCount + 1 " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.retweetsCount < :limit AND r.postsCount < :postLimit")
    int consumeRetweet(@Param("userId") UUID userId, @Param("date") LocalDate date,
                       @Param("limit") int limit, @Param("postLimit") int postLimit);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.repliesCount = r.repliesCount + 1, r.postsCount = r.postsCount + 1 " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.repliesCount < :limit AND r.postsCount < :postLimit")
    int consumeReply(@Param("userId") UUID userId, @Param("date") LocalDate date,
                     @Param("limit") int limit, @Param("postLimit") int postLimit);

    @Modifying
    @Query("UPDATE RateLimitTracker r SET r.postsCount = r.postsCount + :units " +
            "WHERE r.userId = :userId AND r.trackerDate = :date AND r.postsCount + :units <= :limit")
    int consumePosts(@Param("userId") UUID userId, @Param("date") LocalDate date,
                     @Param("limit") int limit, @Param("units") int units);

    @Modifying
    @Query("DELETE FROM RateLimitTracker r WHERE r.trackerDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);

    @Modifying
    @Query("DELETE FROM RateLimitTracker r WHERE r.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
