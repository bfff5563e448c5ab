package com.growthpilot.platform.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row per dispatch attempt. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "tweet_execution_logs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_tweet_execution_attempt", columnNames = {"scheduled_tweet_id", "attempt_number"})
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TweetExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "scheduled_tweet_id", nullable = false)
    private UUID scheduledTweetId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TweetStatus status;

    @Column(nullable = false)
    private Boolean success;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "platform_response", columnDefinition = "TEXT")
    private String platformResponse;

    @Column(name = "error_code", length = 50)
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;
}
