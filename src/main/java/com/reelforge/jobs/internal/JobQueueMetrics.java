package com.reelforge.jobs.internal;

import com.reelforge.jobs.JobQueue;
import com.reelforge.jobs.JobStatus;
import com.reelforge.jobs.JobType;
import com.reelforge.jobs.QueueStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class JobQueueMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobQueueMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobQueue jobQueue;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile QueueStats cachedSnapshot = QueueStats.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public JobQueueMetrics(JobQueue jobQueue, MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering job queue gauges...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("reelforge.jobs.count", this, metrics -> metrics.getSnapshot().countFor(status))
                    .description("Jobs created in the last 24 hours by status")
                    .tag("status", status.getCode())
                    .register(meterRegistry);
        }

        for (JobType type : JobType.values()) {
            Gauge.builder("reelforge.jobs.active", this, metrics -> metrics.activeCount(type))
                    .description("Pending and processing jobs by type")
                    .tag("type", type.getCode())
                    .register(meterRegistry);
        }
    }

    private double activeCount(JobType type) {
        QueueStats.TypeActivity activity = getSnapshot().byType().get(type);
        return activity == null ? 0 : activity.pending() + activity.processing();
    }

    private QueueStats getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private QueueStats loadSnapshot() {
        try {
            return jobQueue.stats();
        } catch (Exception e) {
            log.trace("Failed to query queue stats for metrics: {}", e.getMessage());
            return QueueStats.empty();
        }
    }
}
