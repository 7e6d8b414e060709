package com.reelforge.jobs;

import java.util.Map;

/**
 * Queue snapshot. Status counts cover jobs created in the trailing 24 hours;
 * {@code byType} covers every currently active job regardless of age.
 */
public record QueueStats(
        long pending,
        long processing,
        long completed,
        long failed,
        long cancelled,
        Map<JobType, TypeActivity> byType) {

    public QueueStats {
        byType = Map.copyOf(byType);
    }

    public long total() {
        return pending + processing + completed + failed + cancelled;
    }

    public long countFor(JobStatus status) {
        return switch (status) {
            case PENDING -> pending;
            case PROCESSING -> processing;
            case COMPLETED -> completed;
            case FAILED -> failed;
            case CANCELLED -> cancelled;
        };
    }

    public static QueueStats empty() {
        return new QueueStats(0, 0, 0, 0, 0, Map.of());
    }

    public record TypeActivity(long pending, long processing) {
    }
}
