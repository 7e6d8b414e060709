package com.reelforge.jobs.internal;

import com.reelforge.config.ReelForgeProperties;
import com.reelforge.jobs.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "reelforge.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobQueue jobQueue;
    private final ReelForgeProperties properties;

    public JobCleaner(JobQueue jobQueue, ReelForgeProperties properties) {
        this.jobQueue = jobQueue;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${reelforge.jobs.cleanup-interval-in-seconds:3600}000",
            initialDelayString = "${reelforge.jobs.cleanup-interval-in-seconds:3600}000")
    public void cleanup() {
        int retentionDays = properties.getJobs().getRetentionDays();
        if (retentionDays <= 0) {
            return;
        }
        log.info("Running terminal job cleanup with {} day retention", retentionDays);
        try {
            jobQueue.cleanup(retentionDays);
        } catch (Exception e) {
            log.error("Failed to clean up terminal jobs: {}", e.getMessage(), e);
        }
    }
}
