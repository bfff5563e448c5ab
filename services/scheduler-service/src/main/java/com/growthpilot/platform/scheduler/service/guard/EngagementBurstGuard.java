package com.growthpilot.platform.scheduler.service.guard;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Hourly per-strategy action counters in Redis that keep engagement from looking like spam bursts.
 * Redis being unavailable never blocks a cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngagementBurstGuard {

    private static final String KEY_PREFIX = "burst:";
    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH");
    private static final Set<QuotaAction> GUARDED = EnumSet.of(
            QuotaAction.FOLLOW, QuotaAction.UNFOLLOW, QuotaAction.LIKE, QuotaAction.POST);

    private final StringRedisTemplate redisTemplate;
    private final SchedulerProperties properties;
    private final Clock clock;

    /** True when any guarded counter for the strategy reached its hourly limit. */
    public boolean isSaturated(UUID strategyId) {
        if (!properties.getBurstLimits().isEnabled()) {
            return false;
        }
        try {
            for (QuotaAction action : GUARDED) {
                String value = redisTemplate.opsForValue().get(key(strategyId, action));
                if (value != null && Long.parseLong(value) >= properties.getBurstLimits().hourlyLimitFor(action)) {
                    log.info("Strategy {} reached hourly {} limit", strategyId, action);
                    return true;
                }
            }
            return false;
        } catch (DataAccessException e) {
            log.warn("Burst guard unavailable, allowing strategy {}: {}", strategyId, e.getMessage());
            return false;
        }
    }

    public void record(UUID strategyId, QuotaAction action) {
        if (!properties.getBurstLimits().isEnabled()) {
            return;
        }
        QuotaAction bucket = action.countsAsPost() ? QuotaAction.POST : action;
        String key = key(strategyId, bucket);
        try {
            Long count = redisTemplate.opsForValue().increment(key);
            if (count != null && count == 1) {
                redisTemplate.expire(key, Duration.ofHours(1));
            }
        } catch (DataAccessException e) {
            log.warn("Failed to record {} for strategy {} in burst guard: {}", action, strategyId, e.getMessage());
        }
    }

    private String key(UUID strategyId, QuotaAction action) {
        String hour = HOUR_BUCKET.format(clock.instant().atOffset(ZoneOffset.UTC));
        return KEY_PREFIX + strategyId + ":" + action.name().toLowerCase() + ":" + hour;
    }
}
