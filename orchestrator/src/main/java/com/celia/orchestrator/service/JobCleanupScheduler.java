package com.celia.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention cleanup. Deletes jobs older than {@code celia.jobs.retention-days}.
 */
@Component
@EnableScheduling
public class JobCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobCleanupScheduler.class);

    private final JobService    jobService;
    private final JobProperties properties;

    public JobCleanupScheduler(JobService jobService, JobProperties properties) {
        this.jobService = jobService;
        this.properties = properties;
    }

    @Scheduled(cron = "${celia.jobs.cleanup-cron:0 0 3 * * *}")
    public void cleanup() {
        try {
            jobService.cleanupOldJobs(properties.getRetentionDays());
        } catch (Exception e) {
            // The next run retries; never let the scheduler thread die.
            log.error("Retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
