package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.EngagementStatus;
import com.growthpilot.platform.scheduler.entity.EngagementTarget;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface EngagementTargetRepository extends JpaRepository<EngagementTarget, UUID> {

    @Query("SELECT t FROM EngagementTarget t WHERE t.strategyId = :strategyId AND t.status = :status " +
            "AND (t.scheduledFor IS NULL OR t.scheduledFor <= :now) " +
            "AND (t.claimToken IS NULL OR t.claimedAt < :staleBefore) " +
            "AND (:requireApproval = false OR t.shouldReply = false OR t.replyDone = true OR t.replyApproved = true " +
            "     OR (t.shouldFollow = true AND t.followDone = false AND (t.platformUserId IS NOT NULL " +
            "         OR t.platformUsername IS NOT NULL OR t.tweetAuthorId IS NOT NULL OR t.tweetAuthor IS NOT NULL)) " +
            "     OR (t.shouldLike = true AND t.likeDone = false) " +
            "     OR (t.shouldRetweet = true AND t.retweetDone = false)) " +
            "ORDER BY t.priority DESC, t.relevanceScore DESC, t.scheduledFor ASC NULLS FIRST, t.id ASC")
    List<EngagementTarget> findCandidates(@Param("strategyId") UUID strategyId,
                                          @Param("status") EngagementStatus status,
                                          @Param("now") OffsetDateTime now,
                                          @Param("staleBefore") OffsetDateTime staleBefore,
                                          @Param("requireApproval") boolean requireApproval,
                                          Pageable page);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EngagementTarget t SET t.claimToken = :token, t.claimedAt = :now, t.version = t.version + 1 " +
            "WHERE t.id = :id AND t.status = :status AND (t.claimToken IS NULL OR t.claimedAt < :staleBefore)")
    int claim(@Param("id") UUID id,
              @Param("token") UUID token,
              @Param("now") OffsetDateTime now,
              @Param("status") EngagementStatus status,
              @Param("staleBefore") OffsetDateTime staleBefore);

    // Done flags are written with the engagement log, without bumping the version held by the executor.
    @Modifying
    @Query("UPDATE EngagementTarget t SET t.followDone = true WHERE t.id = :id")
    int markFollowDone(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE EngagementTarget t SET t.likeDone = true WHERE t.id = :id")
    int markLikeDone(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE EngagementTarget t SET t.retweetDone = true WHERE t.id = :id")
    int markRetweetDone(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE EngagementTarget t SET t.replyDone = true WHERE t.id = :id")
    int markReplyDone(@Param("id") UUID id);

    long countByStrategyIdAndStatus(UUID strategyId, EngagementStatus status);

    @Modifying
    @Query("DELETE FROM EngagementTarget t WHERE t.strategyId = :strategyId")
    int deleteByStrategyId(@Param("strategyId") UUID strategyId);
}
