package com.growthpilot.platform.scheduler.service.maintenance;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.repository.RateLimitTrackerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private final RateLimitTrackerRepository trackerRepository;
    private final SchedulerProperties properties;
    private final Clock clock;

    /**
     * Drop daily quota rows older than the retention window. Dates are compared in UTC; a day of
     * slack on either side does not matter for rows kept a week.
     */
    @Transactional
    public int purgeStaleTrackers() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getMaintenance().getTrackerRetentionDays());
        int deleted = trackerRepository.deleteOlderThan(cutoff);
        log.info("Purged {} rate limit trackers dated before {}", deleted, cutoff);
        return deleted;
    }
}
