package com.reelforge.jobs.internal;

import com.reelforge.config.ReelForgeProperties;
import com.reelforge.jobs.JobQueue;
import com.reelforge.jobs.ReapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Recovers jobs left in {@code processing} by a worker that died mid-attempt.
 * Runs on every node; the sweep is a pair of conditional updates, so
 * concurrent sweeps do not double-count.
 */
@Component
@ConditionalOnProperty(prefix = "reelforge.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StuckJobReaper {

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);
    private final JobQueue jobQueue;
    private final Duration timeout;

    public StuckJobReaper(JobQueue jobQueue, ReelForgeProperties properties) {
        this.jobQueue = jobQueue;
        this.timeout = Durations.parse(properties.getJobs().getStuckJobTimeout());
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException("reelforge.jobs.stuck-job-timeout must be positive");
        }
    }

    @Scheduled(fixedDelayString = "${reelforge.jobs.reaper-interval-in-seconds:60}000")
    public void reap() {
        try {
            ReapResult result = jobQueue.requeueStuckJobs(timeout);
            log.debug("Stuck job sweep finished: {} requeued, {} failed", result.requeued(), result.failed());
        } catch (Exception e) {
            log.error("Stuck job sweep failed: {}", e.getMessage(), e);
        }
    }

    Duration getTimeout() {
        return timeout;
    }
}
