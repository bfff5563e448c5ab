package com.growthpilot.platform.scheduler.service.quota;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.dto.QuotaUsageResponse;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import com.growthpilot.platform.scheduler.entity.RateLimitTracker;
import com.growthpilot.platform.scheduler.repository.RateLimitTrackerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-user daily action counters. A unit is granted only by a single conditional increment, so
 * concurrent callers can never push a counter past its limit. Counters are keyed by calendar date:
 * a new date simply starts from zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaTracker {

    private final RateLimitTrackerRepository trackerRepository;
    private final SchedulerProperties properties;
    private final TransactionTemplate transactionTemplate;
    @Qualifier("requiresNewTransactionTemplate")
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final Clock clock;

    /** Consume one unit, capped by the platform ceiling only. */
    public boolean tryConsume(UUID userId, QuotaAction action, LocalDate date) {
        return tryConsume(userId, action, date, Integer.MAX_VALUE, 1);
    }

    /**
     * Consume one unit against {@code min(requestedLimit, platform ceiling)}.
     *
     * @return false when the limit is already reached or is not positive
     */
    public boolean tryConsume(UUID userId, QuotaAction action, LocalDate date, int requestedLimit) {
        return tryConsume(userId, action, date, requestedLimit, 1);
    }

    /**
     * Consume {@code units} at once; only POST supports more than one unit (a thread of several tweets).
     */
    public boolean tryConsume(UUID userId, QuotaAction action, LocalDate date, int requestedLimit, int units) {
        int limit = effectiveLimit(action, requestedLimit);
        if (limit <= 0 || units <= 0 || units > limit) {
            log.debug("Quota {} for user {} on {} refused: limit {}", action, userId, date, limit);
            return false;
        }
        if (units > 1 && action != QuotaAction.POST) {
            throw new IllegalArgumentException("Multi-unit consumption is only supported for POST");
        }

        ensureTracker(userId, date);

        Integer updated = transactionTemplate.execute(status -> consume(userId, action, date, limit, units));
        boolean granted = updated != null && updated == 1;
        if (!granted) {
            log.info("Quota exhausted: user {} action {} on {} (limit {})", userId, action, date, limit);
        }
        return granted;
    }

    public int effectiveLimit(QuotaAction action, int requestedLimit) {
        return Math.min(requestedLimit, properties.getPlatformLimits().ceilingFor(action));
    }

    public QuotaUsageResponse getUsage(UUID userId, LocalDate date) {
        RateLimitTracker tracker = trackerRepository.findByUserIdAndTrackerDate(userId, date).orElse(null);
        List<QuotaUsageResponse.ActionUsage> usage = Arrays.stream(QuotaAction.values())
                .map(action -> {
                    int used = tracker != null ? tracker.countFor(action) : 0;
                    int limit = properties.getPlatformLimits().ceilingFor(action);
                    return QuotaUsageResponse.ActionUsage.builder()
                            .action(action)
                            .used(used)
                            .limit(limit)
                            .remaining(Math.max(0, limit - used))
                            .build();
                })
                .collect(Collectors.toList());
        return QuotaUsageResponse.builder()
                .userId(userId)
                .date(date)
                .actions(usage)
                .build();
    }

    private int consume(UUID userId, QuotaAction action, LocalDate date, int limit, int units) {
        int postLimit = properties.getPlatformLimits().ceilingFor(QuotaAction.POST);
        return switch (action) {
            case FOLLOW -> trackerRepository.consumeFollow(userId, date, limit);
            case UNFOLLOW -> trackerRepository.consumeUnfollow(userId, date, limit);
            case LIKE -> trackerRepository.consumeLike(userId, date, limit);
            case RETWEET -> trackerRepository.consumeRetweet(userId, date, limit, postLimit);
            case REPLY -> trackerRepository.consumeReply(userId, date, limit, postLimit);
            case POST -> trackerRepository.consumePosts(userId, date, limit, units);
        };
    }

    private void ensureTracker(UUID userId, LocalDate date) {
        if (trackerRepository.findByUserIdAndTrackerDate(userId, date).isPresent()) {
            return;
        }
        try {
            requiresNewTransactionTemplate.executeWithoutResult(status ->
                    trackerRepository.saveAndFlush(RateLimitTracker.builder()
                            .userId(userId)
                            .trackerDate(date)
                            .lastReset(OffsetDateTime.now(clock))
                            .build()));
            log.debug("Created rate limit tracker for user {} on {}", userId, date);
        } catch (DataIntegrityViolationException e) {
            log.debug("Rate limit tracker for user {} on {} was created concurrently", userId, date);
        }
    }
}
