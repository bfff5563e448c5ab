package com.growthpilot.platform.scheduler.repository;

import com.growthpilot.platform.scheduler.entity.TweetExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.UUID;

public interface TweetExecutionLogRepository extends JpaRepository<TweetExecutionLog, UUID> {

    List<TweetExecutionLog> findByScheduledTweetIdOrderByAttemptNumberAsc(UUID scheduledTweetId);

    long countByScheduledTweetId(UUID scheduledTweetId);
}
