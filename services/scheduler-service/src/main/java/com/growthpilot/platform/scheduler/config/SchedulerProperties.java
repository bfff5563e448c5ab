package com.growthpilot.platform.scheduler.config;

import com.growthpilot.platform.scheduler.entity.QuotaAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Validated
public class SchedulerProperties {

    @Valid
    private final Dispatch dispatch = new Dispatch();
    @Valid
    private final Retry retry = new Retry();
    @Valid
    private final Growth growth = new Growth();
    @Valid
    private final PlatformLimits platformLimits = new PlatformLimits();
    @Valid
    private final BurstLimits burstLimits = new BurstLimits();
    @Valid
    private final Maintenance maintenance = new Maintenance();
    @Valid
    private final Audit audit = new Audit();
    private final Jobs jobs = new Jobs();

    @Data
    public static class Dispatch {
        @Positive
        private int batchSize = 50;
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(60);
        @NotNull
        private Duration claimTimeout = Duration.ofMinutes(10);
        @Positive
        private int workerThreads = 8;
        @Positive
        private int queueCapacity = 200;
        @Positive
        private int maxContentLength = 280;
    }

    @Data
    public static class Retry {
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(60);
        @NotNull
        private Duration maxDelay = Duration.ofHours(1);
    }

    @Data
    public static class Growth {
        @Positive
        private int batchSize = 10;
        @NotNull
        private Duration pollInterval = Duration.ofMinutes(5);
        @NotNull
        private Duration claimTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration metricsInterval = Duration.ofHours(6);
        @Min(0)
        private int maxActionRetries = 3;
        @NotNull
        private QuotaExhaustedPolicy quotaExhaustedPolicy = QuotaExhaustedPolicy.SKIP;
        private boolean stopOnRateLimit = true;
    }

    /** What happens to a target whose requested actions were all or partly refused by quota. */
    public enum QuotaExhaustedPolicy {
        SKIP,
        DEFER
    }

    /**
     * Per-user daily ceilings imposed by the platform. Retweets and replies share the post ceiling.
     */
    @Data
    public static class PlatformLimits {
        @Min(0)
        private int follow = 400;
        @Min(0)
        private int unfollow = 500;
        @Min(0)
        private int like = 1000;
        @Min(0)
        private int post = 100;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double safetyMargin = 0.95;

        public int ceilingFor(QuotaAction action) {
            int raw = switch (action) {
                case FOLLOW -> follow;
                case UNFOLLOW -> unfollow;
                case LIKE -> like;
                case RETWEET, REPLY, POST -> post;
            };
            return (int) Math.floor(raw * safetyMargin);
        }
    }

    @Data
    public static class BurstLimits {
        private boolean enabled = true;
        @Min(0)
        private int follows = 40;
        @Min(0)
        private int unfollows = 25;
        @Min(0)
        private int likes = 80;
        @Min(0)
        private int posts = 15;

        public int hourlyLimitFor(QuotaAction action) {
            return switch (action) {
                case FOLLOW -> follows;
                case UNFOLLOW -> unfollows;
                case LIKE -> likes;
                case RETWEET, REPLY, POST -> posts;
            };
        }
    }

    @Data
    public static class Maintenance {
        @Positive
        private int trackerRetentionDays = 7;
        @NotBlank
        private String cron = "0 0 3 * * *";
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
        @NotBlank
        private String exchange = "scheduler.events";
    }

    @Data
    public static class Jobs {
        private boolean enabled = true;
    }
}
