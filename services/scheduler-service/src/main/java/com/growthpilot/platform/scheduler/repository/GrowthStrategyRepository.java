package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.GrowthStrategy;
import com.growthpilot.platform.scheduler.entity.StrategyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GrowthStrategyRepository extends JpaRepository<GrowthStrategy, UUID> {

    Optional<GrowthStrategy> findByIdAndDeletedAtIsNull(UUID id);

    List<GrowthStrategy> findByUserId(UUID userId);

    @Query("SELECT s FROM GrowthStrategy s WHERE s.status = :status AND s.deletedAt IS NULL ORDER BY s.createdAt ASC, s.id ASC")
    List<GrowthStrategy> findByStatus(@Param("status") StrategyStatus status);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalFollows = s.totalFollows + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementFollows(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalUnfollows = s.totalUnfollows + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementUnfollows(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalLikes = s.totalLikes + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementLikes(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalRetweets = s.totalRetweets + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementRetweets(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalReplies = s.totalReplies + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementReplies(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE GrowthStrategy s SET s.totalPosts = s.totalPosts + 1, s.version = s.version + 1 WHERE s.id = :id")
    int incrementPosts(@Param("id") UUID id);
}
