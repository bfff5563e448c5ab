package com.growthpilot.platform.scheduler.job;

import com.growthpilot.platform.scheduler.service.growth.GrowthStrategyScheduler;
import com.growthpilot.platform.scheduler.service.growth.StrategyMetricsService;
import com.growthpilot.platform.scheduler.service.maintenance.MaintenanceService;
import com.growthpilot.platform.scheduler.service.tweet.TweetDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers. Each trigger runs one cycle; fixed delays mean a slow cycle is never
 * overlapped by the next one on the same instance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "scheduler.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerJobs {

    private final TweetDispatcher tweetDispatcher;
    private final GrowthStrategyScheduler growthScheduler;
    private final StrategyMetricsService metricsService;
    private final MaintenanceService maintenanceService;

    @Scheduled(fixedDelayString = "${scheduler.dispatch.poll-interval:PT60S}", initialDelayString = "PT10S")
    public void dispatchDueTweets() {
        try {
            tweetDispatcher.runCycle();
        } catch (RuntimeException e) {
            log.error("Tweet dispatch cycle failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.growth.poll-interval:PT5M}", initialDelayString = "PT30S")
    public void runGrowthStrategies() {
        try {
            growthScheduler.runCycle();
        } catch (RuntimeException e) {
            log.error("Growth strategy cycle failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.growth.metrics-interval:PT6H}", initialDelayString = "PT1M")
    public void refreshStrategyMetrics() {
        try {
            metricsService.refreshMetrics();
        } catch (RuntimeException e) {
            log.error("Strategy metrics refresh failed", e);
        }
    }

    @Scheduled(cron = "${scheduler.maintenance.cron:0 0 3 * * *}", zone = "UTC")
    public void purgeStaleTrackers() {
        try {
            maintenanceService.purgeStaleTrackers();
        } catch (RuntimeException e) {
            log.error("Rate limit tracker purge failed", e);
        }
    }
}
