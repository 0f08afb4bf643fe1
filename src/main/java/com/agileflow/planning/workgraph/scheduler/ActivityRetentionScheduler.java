package com.agileflow.planning.workgraph.scheduler;

import com.agileflow.planning.workgraph.service.activity.ActivityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Deletes activity events older than the retention period.
 * Runs daily at 03:00 by default.
 */
@Component
@Slf4j
public class ActivityRetentionScheduler {

    private final ActivityService activityService;
    private final int retentionDays;

    public ActivityRetentionScheduler(ActivityService activityService,
                                      @Value("${workgraph.activity.retention-days:180}") int retentionDays) {
        this.activityService = activityService;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${workgraph.activity.retention-cron:0 0 3 * * *}")
    public void purgeExpiredActivity() {
        log.debug("Running activity retention cleanup...");
        try {
            long purged = activityService.purgeOlderThan(LocalDateTime.now().minusDays(retentionDays));
            if (purged > 0) {
                log.info("Activity retention completed: {} event(s) older than {} days removed", purged, retentionDays);
            }
        } catch (Exception e) {
            log.error("Activity retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
