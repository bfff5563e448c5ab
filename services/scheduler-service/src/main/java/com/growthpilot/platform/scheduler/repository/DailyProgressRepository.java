package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.DailyProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DailyProgressRepository extends JpaRepository<DailyProgress, UUID> {

    Optional<DailyProgress> findByStrategyIdAndProgressDate(UUID strategyId, LocalDate progressDate);

    List<DailyProgress> findByStrategyIdOrderByProgressDateAsc(UUID strategyId);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.followsDone = p.followsDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementFollows(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.unfollowsDone = p.unfollowsDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementUnfollows(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.likesDone = p.likesDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementLikes(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.retweetsDone = p.retweetsDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementRetweets(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.repliesDone = p.repliesDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementReplies(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.postsDone = p.postsDone + 1 WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int incrementPosts(@Param("strategyId") UUID strategyId, @Param("date") LocalDate date);

    @Modifying
    @Query("UPDATE DailyProgress p SET p.followerCount = :followers, p.followingCount = :following " +
            "WHERE p.strategyId = :strategyId AND p.progressDate = :date")
    int updateSnapshot(@Param("strategyId") UUID strategyId,
                       @Param("date") LocalDate date,
                       @Param("followers") Integer followers,
                       @Param("following") Integer following);

    @Modifying
    @Query("DELETE FROM DailyProgress p WHERE p.strategyId = :strategyId")
    int deleteByStrategyId(@Param("strategyId") UUID strategyId);
}
