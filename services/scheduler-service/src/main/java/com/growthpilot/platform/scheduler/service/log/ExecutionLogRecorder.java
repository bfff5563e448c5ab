package com.growthpilot.platform.scheduler.service.log;

import com.growthpilot.platform.scheduler.entity.ActionType;
import com.growthpilot.platform.scheduler.entity.DailyProgress;
import com.growthpilot.platform.scheduler.entity.EngagementLog;
import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetExecutionLog;
import com.growthpilot.platform.scheduler.repository.DailyProgressRepository;
import com.growthpilot.platform.scheduler.repository.EngagementLogRepository;
import com.growthpilot.platform.scheduler.repository.EngagementTargetRepository;
import com.growthpilot.platform.scheduler.repository.GrowthStrategyRepository;
import com.growthpilot.platform.scheduler.repository.TweetExecutionLogRepository;
import com.growthpilot.platform.scheduler.service.tweet.TweetAttemptOutcome;
import com.growthpilot.platform.scheduler.service.tweet.TweetClaim;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Append-only attempt and engagement logs. Each row is written in the same transaction as the
 * status or counter change it describes; no code path updates a log row afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionLogRecorder {

    private final TweetExecutionLogRepository executionLogRepository;
    private final EngagementLogRepository engagementLogRepository;
    private final GrowthStrategyRepository strategyRepository;
    private final DailyProgressRepository progressRepository;
    private final EngagementTargetRepository targetRepository;
    private final TransactionTemplate transactionTemplate;
    @Qualifier("requiresNewTransactionTemplate")
    private final TransactionTemplate requiresNewTransactionTemplate;

    /**
     * Must run inside the transaction that finalizes {@code tweet}; the tweet already carries its new status.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TweetExecutionLog recordTweetAttempt(ScheduledTweet tweet, TweetClaim claim, TweetAttemptOutcome outcome) {
        TweetExecutionLog entry = TweetExecutionLog.builder()
                .scheduledTweetId(tweet.getId())
                .attemptNumber(claim.getAttemptNumber())
                .status(tweet.getStatus())
                .success(outcome.isSuccess())
                .startedAt(outcome.getStartedAt())
                .completedAt(outcome.getCompletedAt())
                .platformResponse(outcome.getPlatformResponse())
                .errorCode(outcome.getErrorCode())
                .errorMessage(outcome.getErrorMessage())
                .build();
        TweetExecutionLog saved = executionLogRepository.save(entry);
        log.debug("Recorded attempt {} for tweet {} -> {}", claim.getAttemptNumber(), tweet.getId(), tweet.getStatus());
        return saved;
    }

    /**
     * Persist an engagement log entry. A successful entry also bumps the strategy running total,
     * the day's progress counter and the target's done flag, all in one transaction.
     */
    public EngagementLog recordEngagement(EngagementLog entry, LocalDate progressDate) {
        if (!Boolean.TRUE.equals(entry.getSuccess())) {
            return transactionTemplate.execute(status -> engagementLogRepository.save(entry));
        }
        ensureDailyProgress(entry.getStrategyId(), progressDate);
        return transactionTemplate.execute(status -> {
            EngagementLog saved = engagementLogRepository.save(entry);
            incrementRunningTotal(entry.getStrategyId(), entry.getActionType());
            incrementDailyProgress(entry.getStrategyId(), progressDate, entry.getActionType());
            if (entry.getTargetId() != null) {
                markTargetActionDone(entry.getTargetId(), entry.getActionType());
            }
            return saved;
        });
    }

    public void recordFollowerSnapshot(UUID strategyId, LocalDate date, Integer followers, Integer following) {
        ensureDailyProgress(strategyId, date);
        transactionTemplate.executeWithoutResult(status ->
                progressRepository.updateSnapshot(strategyId, date, followers, following));
    }

    private void ensureDailyProgress(UUID strategyId, LocalDate date) {
        if (progressRepository.findByStrategyIdAndProgressDate(strategyId, date).isPresent()) {
            return;
        }
        try {
            requiresNewTransactionTemplate.executeWithoutResult(status ->
                    progressRepository.saveAndFlush(DailyProgress.builder()
                            .strategyId(strategyId)
                            .progressDate(date)
                            .build()));
        } catch (DataIntegrityViolationException e) {
            log.debug("Daily progress for strategy {} on {} was created concurrently", strategyId, date);
        }
    }

    private void incrementRunningTotal(UUID strategyId, ActionType action) {
        switch (action) {
            case FOLLOW -> strategyRepository.incrementFollows(strategyId);
            case UNFOLLOW -> strategyRepository.incrementUnfollows(strategyId);
            case LIKE -> strategyRepository.incrementLikes(strategyId);
            case RETWEET -> strategyRepository.incrementRetweets(strategyId);
            case REPLY -> strategyRepository.incrementReplies(strategyId);
            case POST -> strategyRepository.incrementPosts(strategyId);
            default -> log.debug("No running total for {}", action);
        }
    }

    private void incrementDailyProgress(UUID strategyId, LocalDate date, ActionType action) {
        switch (action) {
            case FOLLOW -> progressRepository.incrementFollows(strategyId, date);
            case UNFOLLOW -> progressRepository.incrementUnfollows(strategyId, date);
            case LIKE -> progressRepository.incrementLikes(strategyId, date);
            case RETWEET -> progressRepository.incrementRetweets(strategyId, date);
            case REPLY -> progressRepository.incrementReplies(strategyId, date);
            case POST -> progressRepository.incrementPosts(strategyId, date);
            default -> log.debug("No daily counter for {}", action);
        }
    }

    private void markTargetActionDone(UUID targetId, ActionType action) {
        switch (action) {
            case FOLLOW -> targetRepository.markFollowDone(targetId);
            case LIKE -> targetRepository.markLikeDone(targetId);
            case RETWEET -> targetRepository.markRetweetDone(targetId);
            case REPLY -> targetRepository.markReplyDone(targetId);
            default -> log.debug("{} does not complete a target action", action);
        }
    }
}
