package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.client.FailureClass;
import com.growthpilot.platform.scheduler.client.PlatformClient;
import com.growthpilot.platform.scheduler.client.PlatformClientException;
import com.growthpilot.platform.scheduler.client.PlatformSession;
import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.dto.DispatchCycleReport;
import com.growthpilot.platform.scheduler.dto.PostResult;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import com.growthpilot.platform.scheduler.exception.ContentValidationException;
import com.growthpilot.platform.scheduler.service.audit.AuditEventType;
import com.growthpilot.platform.scheduler.service.audit.AuditPublisher;
import com.growthpilot.platform.scheduler.service.quota.QuotaTracker;
import com.growthpilot.platform.scheduler.service.retry.RetryController;
import com.growthpilot.platform.scheduler.service.retry.RetryDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives scheduled tweets through claim, post, record and finalize. The claim and the finalize
 * are separate short transactions; nothing is held open while the platform call is in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TweetDispatcher {

    private final ScheduledTweetStore tweetStore;
    private final QuotaTracker quotaTracker;
    private final RetryController retryController;
    private final PlatformClient platformClient;
    private final TweetContentValidator contentValidator;
    private final AuditPublisher auditPublisher;
    private final SchedulerProperties properties;
    private final Clock clock;
    @Qualifier("dispatchExecutor")
    private final ExecutorService dispatchExecutor;

    public DispatchCycleReport runCycle() {
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        Map<DispatchOutcome, Integer> counts = new EnumMap<>(DispatchOutcome.class);

        int recovered = recoverStaleClaims(startedAt);
        List<ScheduledTweet> due = tweetStore.findDue(startedAt, properties.getDispatch().getBatchSize());

        List<Future<DispatchOutcome>> futures = new ArrayList<>();
        for (ScheduledTweet tweet : due) {
            futures.add(dispatchExecutor.submit(() -> dispatch(tweet)));
        }
        for (Future<DispatchOutcome> future : futures) {
            try {
                counts.merge(future.get(), 1, Integer::sum);
            } catch (ExecutionException e) {
                log.error("Dispatch task failed", e.getCause());
                counts.merge(DispatchOutcome.ERROR, 1, Integer::sum);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dispatch cycle interrupted with {} tasks outstanding", futures.size());
                break;
            }
        }

        DispatchCycleReport report = DispatchCycleReport.builder()
                .startedAt(startedAt)
                .finishedAt(OffsetDateTime.now(clock))
                .due(due.size())
                .recoveredClaims(recovered)
                .posted(counts.getOrDefault(DispatchOutcome.POSTED, 0))
                .retryScheduled(counts.getOrDefault(DispatchOutcome.RETRY_SCHEDULED, 0))
                .failed(counts.getOrDefault(DispatchOutcome.FAILED, 0))
                .deferredForQuota(counts.getOrDefault(DispatchOutcome.DEFERRED_QUOTA, 0))
                .lostRace(counts.getOrDefault(DispatchOutcome.LOST_RACE, 0))
                .errors(counts.getOrDefault(DispatchOutcome.ERROR, 0))
                .build();
        if (!due.isEmpty() || recovered > 0) {
            log.info("Tweet dispatch cycle: due={}, posted={}, retrying={}, failed={}, deferred={}, lost={}, errors={}",
                    report.getDue(), report.getPosted(), report.getRetryScheduled(), report.getFailed(),
                    report.getDeferredForQuota(), report.getLostRace(), report.getErrors());
        }
        return report;
    }

    /** One attempt for one tweet. Never throws: every failure ends up in the returned outcome. */
    public DispatchOutcome dispatch(ScheduledTweet snapshot) {
        try {
            return attempt(snapshot);
        } catch (RuntimeException e) {
            log.error("Unexpected error dispatching tweet {}", snapshot.getId(), e);
            return DispatchOutcome.ERROR;
        }
    }

    private DispatchOutcome attempt(ScheduledTweet snapshot) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<TweetClaim> claimed = tweetStore.claim(snapshot, now);
        if (claimed.isEmpty()) {
            return DispatchOutcome.LOST_RACE;
        }
        TweetClaim claim = claimed.get();
        log.info("Claimed tweet {} for attempt {}", claim.getTweetId(), claim.getAttemptNumber());

        try {
            contentValidator.validate(claim);
        } catch (ContentValidationException e) {
            log.warn("Tweet {} has invalid content: {}", claim.getTweetId(), e.getMessage());
            return finish(claim, TweetAttemptOutcome.failed(FailureClass.PERMANENT, "CONTENT_INVALID",
                    e.getMessage(), RetryDecision.fail(), now, OffsetDateTime.now(clock)));
        }

        LocalDate quotaDate = now.atZoneSameInstant(claim.zone()).toLocalDate();
        if (!quotaTracker.tryConsume(claim.getUserId(), QuotaAction.POST, quotaDate,
                Integer.MAX_VALUE, claim.getSegments().size())) {
            return deferForQuota(claim, quotaDate);
        }

        OffsetDateTime attemptStarted = OffsetDateTime.now(clock);
        TweetAttemptOutcome outcome;
        try (PlatformSession session = platformClient.openSession(claim.getUserId())) {
            PostResult result = claim.isThread()
                    ? session.postThread(claim.getSegments(), claim.getMediaUrls())
                    : session.postTweet(claim.getSegments().get(0), claim.getMediaUrls());
            outcome = TweetAttemptOutcome.posted(result, attemptStarted, OffsetDateTime.now(clock));
        } catch (PlatformClientException e) {
            log.warn("Posting tweet {} failed ({}, {}): {}", claim.getTweetId(), e.getFailureClass(),
                    e.getErrorCode(), e.getMessage());
            outcome = failure(claim, e.getFailureClass(), e.getErrorCode(), e.getMessage(),
                    e.getRetryAfter(), attemptStarted);
        } catch (RuntimeException e) {
            log.error("Unexpected error posting tweet {}", claim.getTweetId(), e);
            outcome = failure(claim, FailureClass.TRANSIENT, "UNEXPECTED_ERROR", e.getMessage(),
                    null, attemptStarted);
        }
        return finish(claim, outcome);
    }

    private DispatchOutcome deferForQuota(TweetClaim claim, LocalDate quotaDate) {
        OffsetDateTime nextDay = quotaDate.plusDays(1).atStartOfDay(claim.zone()).toOffsetDateTime();
        if (!tweetStore.release(claim, nextDay)) {
            log.warn("Could not release claim on tweet {} after quota refusal", claim.getTweetId());
            return DispatchOutcome.LOST_RACE;
        }
        log.info("Daily post quota reached for user {}; tweet {} deferred to {}",
                claim.getUserId(), claim.getTweetId(), nextDay);
        auditPublisher.publish(AuditEventType.TWEET_DEFERRED_QUOTA, claim.getUserId(), claim.getTweetId(),
                claim.getPreviousStatus(), "Deferred to " + nextDay);
        return DispatchOutcome.DEFERRED_QUOTA;
    }

    /**
     * Tweets left in POSTING longer than the claim timeout lost their worker. Their attempt is
     * recorded as a transient failure so the usual retry budget applies.
     */
    int recoverStaleClaims(OffsetDateTime now) {
        OffsetDateTime cutoff = now.minus(properties.getDispatch().getClaimTimeout());
        int recovered = 0;
        for (ScheduledTweet stale : tweetStore.findStaleClaims(cutoff)) {
            TweetClaim claim = TweetClaim.of(stale, TweetStatus.PENDING);
            log.warn("Recovering expired claim on tweet {} (claimed at {})", claim.getTweetId(), claim.getClaimedAt());
            TweetAttemptOutcome outcome = failure(claim, FailureClass.TRANSIENT, "CLAIM_EXPIRED",
                    "Claim expired before the attempt was finalized", null, claim.getClaimedAt());
            if (finish(claim, outcome) != DispatchOutcome.LOST_RACE) {
                recovered++;
            }
        }
        return recovered;
    }

    private TweetAttemptOutcome failure(TweetClaim claim, FailureClass failureClass, String errorCode,
                                        String message, Duration retryAfter, OffsetDateTime startedAt) {
        RetryDecision decision = retryController
                .decide(claim.getRetryCount(), claim.getMaxRetries(), failureClass)
                .withMinimumDelay(retryAfter);
        return TweetAttemptOutcome.failed(failureClass, errorCode, message, decision,
                startedAt, OffsetDateTime.now(clock));
    }

    private DispatchOutcome finish(TweetClaim claim, TweetAttemptOutcome outcome) {
        Optional<TweetStatus> finalized;
        try {
            finalized = tweetStore.finalizeAttempt(claim, outcome);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Tweet {} changed while finalizing attempt {}; outcome discarded",
                    claim.getTweetId(), claim.getAttemptNumber());
            return DispatchOutcome.LOST_RACE;
        }
        if (finalized.isEmpty()) {
            return DispatchOutcome.LOST_RACE;
        }

        TweetStatus status = finalized.get();
        switch (status) {
            case POSTED -> {
                log.info("Posted tweet {} as {}", claim.getTweetId(), outcome.getPlatformTweetId());
                auditPublisher.publish(AuditEventType.TWEET_POSTED, claim.getUserId(), claim.getTweetId(),
                        status, outcome.getPlatformTweetId());
                return DispatchOutcome.POSTED;
            }
            case RETRYING -> {
                log.info("Tweet {} will retry at {} after {}", claim.getTweetId(), outcome.getNextAttemptAt(),
                        outcome.getErrorCode());
                auditPublisher.publish(AuditEventType.TWEET_RETRY_SCHEDULED, claim.getUserId(), claim.getTweetId(),
                        status, outcome.describeError());
                return DispatchOutcome.RETRY_SCHEDULED;
            }
            default -> {
                log.error("Tweet {} failed permanently after attempt {}: {}", claim.getTweetId(),
                        claim.getAttemptNumber(), outcome.describeError());
                auditPublisher.publish(AuditEventType.TWEET_FAILED, claim.getUserId(), claim.getTweetId(),
                        status, outcome.describeError());
                return DispatchOutcome.FAILED;
            }
        }
    }
}
