package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ScheduledTweetRepository extends JpaRepository<ScheduledTweet, UUID> {

    Optional<ScheduledTweet> findByIdAndDeletedAtIsNull(UUID id);

    List<ScheduledTweet> findByUserIdAndDeletedAtIsNull(UUID userId);

    @Query("SELECT t FROM ScheduledTweet t WHERE t.status IN :statuses AND t.scheduledFor <= :now " +
            "AND t.deletedAt IS NULL ORDER BY t.scheduledFor ASC, t.id ASC")
    List<ScheduledTweet> findDue(@Param("statuses") Collection<TweetStatus> statuses,
                                 @Param("now") OffsetDateTime now,
                                 Pageable page);

    @Query("SELECT t FROM ScheduledTweet t WHERE t.status = :status AND t.claimedAt < :cutoff ORDER BY t.claimedAt ASC")
    List<ScheduledTweet> findStaleClaims(@Param("status") TweetStatus status,
                                         @Param("cutoff") OffsetDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledTweet t SET t.status = :claimed, t.claimToken = :token, t.claimedAt = :now, " +
            "t.lastAttemptAt = :now, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.status = :expected AND t.version = :version " +
            "AND t.scheduledFor <= :now AND t.deletedAt IS NULL")
    int claim(@Param("id") UUID id,
              @Param("expected") TweetStatus expected,
              @Param("version") Long version,
              @Param("claimed") TweetStatus claimed,
              @Param("token") UUID token,
              @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledTweet t SET t.status = :previous, t.claimToken = NULL, t.claimedAt = NULL, " +
            "t.scheduledFor = :nextAttemptAt, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.status = :claimed AND t.claimToken = :token")
    int release(@Param("id") UUID id,
                @Param("token") UUID token,
                @Param("claimed") TweetStatus claimed,
                @Param("previous") TweetStatus previous,
                @Param("nextAttemptAt") OffsetDateTime nextAttemptAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledTweet t SET t.status = :cancelled, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.status IN :cancellable")
    int cancel(@Param("id") UUID id,
               @Param("cancelled") TweetStatus cancelled,
               @Param("cancellable") Collection<TweetStatus> cancellable);
}
