package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import com.growthpilot.platform.scheduler.exception.IllegalStateTransitionException;
import com.growthpilot.platform.scheduler.exception.ResourceNotFoundException;
import com.growthpilot.platform.scheduler.repository.ScheduledTweetRepository;
import com.growthpilot.platform.scheduler.service.log.ExecutionLogRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * All writes to scheduled tweets go through here. Claims, releases and cancellations are
 * compare-and-swap updates; finalization requires the claim token to still be held.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledTweetStore {

    private final ScheduledTweetRepository tweetRepository;
    private final ExecutionLogRecorder logRecorder;

    @Transactional(readOnly = true)
    public List<ScheduledTweet> findDue(OffsetDateTime now, int limit) {
        return tweetRepository.findDue(TweetStatus.claimable(), now, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<ScheduledTweet> findStaleClaims(OffsetDateTime cutoff) {
        return tweetRepository.findStaleClaims(TweetStatus.POSTING, cutoff);
    }

    @Transactional(readOnly = true)
    public ScheduledTweet get(UUID tweetId) {
        return tweetRepository.findByIdAndDeletedAtIsNull(tweetId)
                .orElseThrow(() -> new ResourceNotFoundException("ScheduledTweet", tweetId));
    }

    /**
     * Move the tweet from the status seen in {@code snapshot} to POSTING. Empty when anyone else
     * changed the row since the snapshot was read.
     */
    @Transactional
    public Optional<TweetClaim> claim(ScheduledTweet snapshot, OffsetDateTime now) {
        if (!TweetStatus.claimable().contains(snapshot.getStatus())) {
            return Optional.empty();
        }
        UUID token = UUID.randomUUID();
        int updated = tweetRepository.claim(snapshot.getId(), snapshot.getStatus(), snapshot.getVersion(),
                TweetStatus.POSTING, token, now);
        if (updated == 0) {
            log.debug("Lost claim on tweet {}", snapshot.getId());
            return Optional.empty();
        }
        ScheduledTweet claimed = tweetRepository.findById(snapshot.getId())
                .orElseThrow(() -> new ResourceNotFoundException("ScheduledTweet", snapshot.getId()));
        return Optional.of(TweetClaim.of(claimed, snapshot.getStatus()));
    }

    /** Hand the claim back without an attempt, keeping retry_count untouched. */
    @Transactional
    public boolean release(TweetClaim claim, OffsetDateTime nextAttemptAt) {
        return tweetRepository.release(claim.getTweetId(), claim.getToken(), TweetStatus.POSTING,
                claim.getPreviousStatus(), nextAttemptAt) == 1;
    }

    /**
     * Apply an attempt outcome and append its execution log in one transaction.
     *
     * @return the resulting status, or empty when the claim is no longer held
     */
    @Transactional
    public Optional<TweetStatus> finalizeAttempt(TweetClaim claim, TweetAttemptOutcome outcome) {
        ScheduledTweet tweet = tweetRepository.findById(claim.getTweetId()).orElse(null);
        if (tweet == null || tweet.getStatus() != TweetStatus.POSTING
                || !claim.getToken().equals(tweet.getClaimToken())) {
            log.warn("Discarding outcome of attempt {} for tweet {}: claim no longer held",
                    claim.getAttemptNumber(), claim.getTweetId());
            return Optional.empty();
        }

        if (outcome.isSuccess()) {
            tweet.markPosted(outcome.getPlatformTweetId(), outcome.getThreadIds(), outcome.getCompletedAt());
        } else if (outcome.willRetry()) {
            tweet.markRetrying(outcome.describeError(), outcome.getNextAttemptAt());
        } else {
            tweet.markFailed(outcome.describeError());
        }

        logRecorder.recordTweetAttempt(tweet, claim, outcome);
        tweetRepository.saveAndFlush(tweet);
        return Optional.of(tweet.getStatus());
    }

    /** @return false when the tweet is already being posted or is terminal */
    @Transactional
    public boolean cancel(UUID tweetId) {
        return tweetRepository.cancel(tweetId, TweetStatus.CANCELLED, TweetStatus.cancellable()) == 1;
    }

    @Transactional
    public ScheduledTweet schedule(UUID tweetId) {
        ScheduledTweet tweet = get(tweetId);
        if (!tweet.getStatus().canTransitionTo(TweetStatus.PENDING)) {
            throw new IllegalStateTransitionException("ScheduledTweet", tweetId, tweet.getStatus(), TweetStatus.PENDING);
        }
        tweet.promote();
        return tweetRepository.save(tweet);
    }

    /**
     * Hide the tweet from every read path. Anything still waiting to be posted is cancelled first;
     * a tweet that is being posted right now cannot be deleted.
     */
    @Transactional
    public void softDelete(UUID tweetId, OffsetDateTime at) {
        ScheduledTweet tweet = get(tweetId);
        if (tweet.getStatus() == TweetStatus.POSTING) {
            throw new IllegalStateTransitionException("Tweet " + tweetId + " is being posted and cannot be deleted");
        }
        if (TweetStatus.cancellable().contains(tweet.getStatus()) && cancel(tweetId)) {
            tweet = get(tweetId);
        }
        tweet.setDeletedAt(at);
        tweetRepository.save(tweet);
    }

    @Transactional
    public int softDeleteAllForUser(UUID userId, OffsetDateTime at) {
        int deleted = 0;
        for (ScheduledTweet tweet : tweetRepository.findByUserIdAndDeletedAtIsNull(userId)) {
            if (tweet.getStatus() == TweetStatus.POSTING) {
                log.warn("Tweet {} of user {} is being posted; leaving it for claim recovery", tweet.getId(), userId);
                continue;
            }
            softDelete(tweet.getId(), at);
            deleted++;
        }
        return deleted;
    }
}
