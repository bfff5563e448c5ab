package com.growthpilot.platform.scheduler.config;

import com.growthpilot.platform.scheduler.service.retry.BackoffPolicy;
import com.growthpilot.platform.scheduler.service.retry.ExponentialBackoffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffPolicy backoffPolicy(SchedulerProperties properties) {
        return new ExponentialBackoffPolicy(
                properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay());
    }
}
