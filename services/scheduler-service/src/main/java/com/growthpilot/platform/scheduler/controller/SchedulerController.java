package com.growthpilot.platform.scheduler.controller;

import com.growthpilot.platform.scheduler.dto.*;
import com.growthpilot.platform.scheduler.service.growth.EngagementReversalService;
import com.growthpilot.platform.scheduler.service.growth.GrowthStrategyScheduler;
import com.growthpilot.platform.scheduler.service.growth.StrategyLifecycleService;
import com.growthpilot.platform.scheduler.service.growth.StrategyMetricsService;
import com.growthpilot.platform.scheduler.service.maintenance.AccountDataService;
import com.growthpilot.platform.scheduler.service.quota.QuotaTracker;
import com.growthpilot.platform.scheduler.service.tweet.ScheduledTweetService;
import com.growthpilot.platform.scheduler.service.tweet.TweetDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final ScheduledTweetService tweetService;
    private final TweetDispatcher tweetDispatcher;
    private final StrategyLifecycleService lifecycleService;
    private final StrategyMetricsService metricsService;
    private final EngagementReversalService reversalService;
    private final GrowthStrategyScheduler growthScheduler;
    private final QuotaTracker quotaTracker;
    private final AccountDataService accountDataService;
    private final Clock clock;

    // Tweets

    @GetMapping("/tweets/{tweetId}")
    public ResponseEntity<ScheduledTweetResponse> getTweet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID tweetId
    ) {
        return ResponseEntity.ok(tweetService.getTweet(userId, tweetId));
    }

    @GetMapping("/tweets/{tweetId}/executions")
    public ResponseEntity<List<TweetExecutionResponse>> getExecutions(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID tweetId
    ) {
        return ResponseEntity.ok(tweetService.getExecutions(userId, tweetId));
    }

    @PostMapping("/tweets/{tweetId}/schedule")
    public ResponseEntity<ScheduledTweetResponse> scheduleTweet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID tweetId
    ) {
        return ResponseEntity.ok(tweetService.schedule(userId, tweetId));
    }

    @PostMapping("/tweets/{tweetId}/cancel")
    public ResponseEntity<ScheduledTweetResponse> cancelTweet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID tweetId
    ) {
        return ResponseEntity.ok(tweetService.cancel(userId, tweetId));
    }

    @DeleteMapping("/tweets/{tweetId}")
    public ResponseEntity<Void> deleteTweet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID tweetId
    ) {
        tweetService.delete(userId, tweetId);
        return ResponseEntity.noContent().build();
    }

    // Growth strategies

    @PostMapping("/strategies/{strategyId}/activate")
    public ResponseEntity<StrategyResponse> activateStrategy(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(lifecycleService.activate(userId, strategyId));
    }

    @PostMapping("/strategies/{strategyId}/pause")
    public ResponseEntity<StrategyResponse> pauseStrategy(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(lifecycleService.pause(userId, strategyId));
    }

    @PostMapping("/strategies/{strategyId}/resume")
    public ResponseEntity<StrategyResponse> resumeStrategy(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(lifecycleService.resume(userId, strategyId));
    }

    @PostMapping("/strategies/{strategyId}/cancel")
    public ResponseEntity<StrategyResponse> cancelStrategy(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(lifecycleService.cancel(userId, strategyId));
    }

    @DeleteMapping("/strategies/{strategyId}")
    public ResponseEntity<Void> deleteStrategy(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        lifecycleService.delete(userId, strategyId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/strategies/{strategyId}/progress")
    public ResponseEntity<StrategyProgressResponse> getProgress(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(metricsService.getProgress(userId, strategyId));
    }

    @GetMapping("/strategies/{strategyId}/logs")
    public ResponseEntity<List<EngagementLogResponse>> getEngagementLogs(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId
    ) {
        return ResponseEntity.ok(metricsService.getEngagementLogs(userId, strategyId));
    }

    @PostMapping("/strategies/{strategyId}/targets/{targetId}/approve-reply")
    public ResponseEntity<EngagementTargetResponse> approveReply(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId,
            @PathVariable UUID targetId
    ) {
        return ResponseEntity.ok(lifecycleService.approveReply(userId, strategyId, targetId));
    }

    @PostMapping("/strategies/{strategyId}/logs/{logId}/revert")
    public ResponseEntity<EngagementLogResponse> revertEngagement(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID strategyId,
            @PathVariable UUID logId
    ) {
        return ResponseEntity.ok(reversalService.revert(userId, strategyId, logId));
    }

    // Quota and account

    @GetMapping("/quota")
    public ResponseEntity<QuotaUsageResponse> getQuota(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        return ResponseEntity.ok(quotaTracker.getUsage(userId, day));
    }

    @DeleteMapping("/users/me")
    public ResponseEntity<Void> deleteUserData(
            @RequestHeader("X-User-Id") UUID userId
    ) {
        accountDataService.deleteUserData(userId);
        return ResponseEntity.noContent().build();
    }

    // Cycle triggers

    @PostMapping("/cycles/tweets")
    public ResponseEntity<DispatchCycleReport> runTweetCycle() {
        return ResponseEntity.ok(tweetDispatcher.runCycle());
    }

    @PostMapping("/cycles/growth")
    public ResponseEntity<GrowthCycleReport> runGrowthCycle() {
        return ResponseEntity.ok(growthScheduler.runCycle());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }
}
