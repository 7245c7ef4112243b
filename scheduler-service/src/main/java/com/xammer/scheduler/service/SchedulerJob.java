package com.xammer.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerJob {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerJob.class);

    private final ResourceSchedulerService schedulerService;

    public SchedulerJob(ResourceSchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    /**
     * Runs every 10 minutes by default; override with {@code scheduler.cron}.
     */
    @Scheduled(cron = "${scheduler.cron:0 0/10 * * * *}")
    public void runScheduledPass() {
        try {
            schedulerService.run();
        } catch (Exception e) {
            logger.error("Resource scheduler: fatal error during scheduled run", e);
        }
    }
}
