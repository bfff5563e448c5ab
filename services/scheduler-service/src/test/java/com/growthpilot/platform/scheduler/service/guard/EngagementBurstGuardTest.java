package com.growthpilot.platform.scheduler.service.guard;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.entity.QuotaAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngagementBurstGuardTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private SchedulerProperties properties;
    private EngagementBurstGuard guard;

    private final UUID strategyId = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        guard = new EngagementBurstGuard(redisTemplate, properties,
                Clock.fixed(Instant.parse("2024-03-04T12:15:00Z"), ZoneOffset.UTC));
    }

    private String key(String action) {
        return "burst:" + strategyId + ":" + action + ":2024030412";
    }

    @Test
    void saturatedWhenAnyHourlyCounterReachedItsLimit() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn(null);
        when(valueOperations.get(key("like"))).thenReturn("80");

        assertTrue(guard.isSaturated(strategyId));
    }

    @Test
    void notSaturatedBelowTheLimits() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn("3");

        assertFalse(guard.isSaturated(strategyId));
    }

    @Test
    void firstIncrementOfTheHourSetsTheExpiry() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(key("follow"))).thenReturn(1L);

        guard.record(strategyId, QuotaAction.FOLLOW);

        verify(redisTemplate).expire(key("follow"), Duration.ofHours(1));
    }

    @Test
    void repliesShareThePostBucket() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(key("post"))).thenReturn(4L);

        guard.record(strategyId, QuotaAction.REPLY);

        verify(valueOperations).increment(key("post"));
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void redisOutageFailsOpen() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));

        assertFalse(guard.isSaturated(strategyId));
    }

    @Test
    void disabledGuardNeverTouchesRedis() {
        properties.getBurstLimits().setEnabled(false);

        assertFalse(guard.isSaturated(strategyId));
        guard.record(strategyId, QuotaAction.LIKE);

        verifyNoInteractions(redisTemplate);
    }
}
