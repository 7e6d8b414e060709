package com.reelforge.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelforge.config.ReelForgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point to the job queue: submission, claiming, outcome reporting,
 * cancellation, retention and statistics.
 */
@Service
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 100;
    private static final Duration STATS_WINDOW = Duration.ofHours(24);
    private static final int ANY_ATTEMPT = -1;

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final ReelForgeProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JobQueue(JobRepository jobRepository, ObjectMapper objectMapper, ReelForgeProperties properties,
            TransactionTemplate transactionTemplate, Clock clock) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Submit a job at normal priority, eligible immediately.
     */
    public Job create(JobType type, UUID ownerId, Object payload) {
        return create(type, ownerId, payload, JobPriority.NORMAL, properties.getJobs().getDefaultMaxAttempts(), null);
    }

    /**
     * Submit a job with an explicit priority, eligible immediately.
     */
    public Job create(JobType type, UUID ownerId, Object payload, JobPriority priority) {
        return create(type, ownerId, payload, priority, properties.getJobs().getDefaultMaxAttempts(), null);
    }

    /**
     * Submit a job using a wire type code such as {@code "video_generation"}.
     */
    public Job create(String typeCode, UUID ownerId, Object payload) {
        return create(JobType.fromCode(typeCode), ownerId, payload);
    }

    /**
     * Full submission method.
     *
     * @param scheduledFor earliest time the job may be claimed; {@code null} means now
     * @throws JobValidationException if the type or owner is missing, the owner is unknown,
     *                                or {@code maxAttempts} is below one
     */
    public Job create(JobType type, UUID ownerId, Object payload, JobPriority priority, int maxAttempts,
            OffsetDateTime scheduledFor) {
        if (type == null) {
            throw new JobValidationException("Job type must not be null");
        }
        if (ownerId == null) {
            throw new JobValidationException("Job owner must not be null");
        }
        if (maxAttempts < 1) {
            throw new JobValidationException("maxAttempts must be >= 1");
        }
        OffsetDateTime now = now();
        JsonNode payloadNode = payload != null ? objectMapper.valueToTree(payload) : objectMapper.createObjectNode();
        Job job = new Job(UUID.randomUUID(), type, ownerId, payloadNode,
                priority != null ? priority : JobPriority.NORMAL, maxAttempts, now,
                scheduledFor != null ? scheduledFor : now);
        try {
            Job saved = jobRepository.saveAndFlush(job);
            log.debug("Created job {} of type {} for owner {} scheduled for {}", saved.getId(), type.getCode(),
                    ownerId, saved.getScheduledFor());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new JobValidationException("Job of type " + type.getCode() + " rejected for owner " + ownerId
                    + ": unknown owner or constraint violation", e);
        }
    }

    public Optional<Job> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Newest-first listing of an owner's jobs, optionally filtered.
     *
     * @param limit between 1 and 100
     */
    public List<Job> listJobsForOwner(UUID ownerId, JobStatus status, JobType type, int limit) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId must not be null");
        }
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        Specification<Job> spec = (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        Sort newestFirst = Sort.by(Sort.Direction.DESC, "createdAt", "sequence");
        return jobRepository.findAll(spec, PageRequest.of(0, limit, newestFirst)).getContent();
    }

    public List<Job> listJobsForOwner(UUID ownerId) {
        return listJobsForOwner(ownerId, null, null, DEFAULT_LIST_LIMIT);
    }

    /**
     * Claim the best eligible job of any type.
     */
    public Optional<Job> claim() {
        return claim(List.of());
    }

    /**
     * Atomically take ownership of the highest-priority, earliest-scheduled
     * eligible pending job. Rows locked by a concurrent claimant are skipped,
     * so no two callers ever receive the same job.
     *
     * @param types restricts candidates to these types; empty means any type
     * @return the claimed job, already in {@code processing}, or empty when nothing is eligible
     */
    public Optional<Job> claim(Collection<JobType> types) {
        OffsetDateTime now = now();
        Job claimed = transactionTemplate.execute(status -> {
            List<Job> candidates = types == null || types.isEmpty()
                    ? jobRepository.findClaimCandidates(JobStatus.PENDING, now, PageRequest.of(0, 1))
                    : jobRepository.findClaimCandidatesOfTypes(JobStatus.PENDING, types, now, PageRequest.of(0, 1));
            if (candidates.isEmpty()) {
                return null;
            }
            Job job = candidates.get(0);
            job.markClaimed(now);
            return job;
        });
        if (claimed != null) {
            log.debug("Claimed job {} of type {} (attempt {}/{})", claimed.getId(), claimed.getType().getCode(),
                    claimed.getAttempts(), claimed.getMaxAttempts());
        }
        return Optional.ofNullable(claimed);
    }

    /**
     * Record a successful outcome. Repeating the call on a completed job
     * overwrites its result; cancelled or failed jobs are left untouched.
     *
     * @return {@code true} if the job is now completed with this result
     */
    public boolean complete(UUID jobId, Object result) {
        return complete(jobId, ANY_ATTEMPT, result);
    }

    /**
     * Record a successful outcome for one specific attempt. The report is
     * ignored once the job has been requeued and claimed again, so a worker
     * whose attempt was reaped cannot overwrite the attempt that replaced it.
     *
     * @param attempt the attempt number the job carried when it was claimed
     */
    public boolean complete(UUID jobId, int attempt, Object result) {
        OffsetDateTime now = now();
        JsonNode resultNode = result != null ? objectMapper.valueToTree(result) : objectMapper.createObjectNode();
        Boolean updated = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId)
                .filter(job -> job.getStatus() == JobStatus.PROCESSING || job.getStatus() == JobStatus.COMPLETED)
                .filter(job -> isCurrentAttempt(job, attempt))
                .map(job -> {
                    job.markCompleted(resultNode, now);
                    return true;
                })
                .orElse(false));
        if (Boolean.TRUE.equals(updated)) {
            log.debug("Completed job {}", jobId);
            return true;
        }
        log.debug("Ignored completion of job {}: not found, not in processing or attempt {} superseded", jobId,
                attempt);
        return false;
    }

    /**
     * Record a failed attempt with immediate re-eligibility when retrying.
     *
     * @return the job's new status, or empty if it was not processing
     */
    public Optional<JobStatus> fail(UUID jobId, String error, boolean retry) {
        return fail(jobId, ANY_ATTEMPT, error, retry, null);
    }

    /**
     * Record a failed attempt and, if attempts remain, requeue it no earlier
     * than {@code retryDelay} from now.
     */
    public Optional<JobStatus> fail(UUID jobId, String error, Duration retryDelay) {
        return fail(jobId, ANY_ATTEMPT, error, true, retryDelay);
    }

    /**
     * Record the failure of one specific attempt. Returns empty without
     * touching the job when that attempt has already been superseded.
     *
     * @param retryDelay minimum delay before the job is eligible again; {@code null} means immediately
     */
    public Optional<JobStatus> fail(UUID jobId, int attempt, String error, boolean retry, Duration retryDelay) {
        OffsetDateTime now = now();
        OffsetDateTime nextScheduledFor = retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()
                ? null
                : now.plus(retryDelay);
        JobStatus outcome = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId)
                .filter(job -> job.getStatus() == JobStatus.PROCESSING)
                .filter(job -> isCurrentAttempt(job, attempt))
                .map(job -> {
                    if (retry && job.hasAttemptsRemaining()) {
                        job.markRetryable(error, nextScheduledFor);
                    } else {
                        job.markFailed(error, now);
                    }
                    return job.getStatus();
                })
                .orElse(null));
        if (outcome == null) {
            log.debug("Ignored failure report for job {}: not found, not in processing or attempt {} superseded",
                    jobId, attempt);
        } else if (outcome == JobStatus.FAILED) {
            log.warn("Job {} failed permanently: {}", jobId, error);
        } else {
            log.debug("Job {} requeued after failure: {}", jobId, error);
        }
        return Optional.ofNullable(outcome);
    }

    private boolean isCurrentAttempt(Job job, int attempt) {
        return attempt == ANY_ATTEMPT || job.getAttempts() == attempt;
    }

    /**
     * Cancel a pending or processing job. Workers already running the job are
     * not interrupted.
     *
     * @return {@code false} if the job does not exist or is already terminal
     */
    public boolean cancel(UUID jobId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> jobRepository.markCancelled(jobId,
                JobStatus.CANCELLED, JobStatus.ACTIVE, now));
        boolean cancelled = updated != null && updated > 0;
        if (cancelled) {
            log.info("Cancelled job {}", jobId);
        }
        return cancelled;
    }

    /**
     * Delete terminal jobs whose completion is older than the retention window.
     * Pending and processing jobs are never removed.
     */
    public int cleanup(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must be >= 0");
        }
        OffsetDateTime threshold = now().minusDays(olderThanDays);
        Integer deleted = transactionTemplate.execute(status -> jobRepository
                .deleteTerminalCompletedBefore(JobStatus.TERMINAL, threshold));
        int count = deleted == null ? 0 : deleted;
        if (count > 0) {
            log.info("Cleaned up {} terminal jobs completed before {}", count, threshold);
        }
        return count;
    }

    /**
     * Return processing jobs whose attempt started longer ago than
     * {@code timeout} to the queue, or fail them if they are out of attempts.
     */
    public ReapResult requeueStuckJobs(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        OffsetDateTime now = now();
        OffsetDateTime startedBefore = now.minus(timeout);
        String error = "Processing timed out after " + timeout;
        ReapResult result = transactionTemplate.execute(status -> {
            int requeued = jobRepository.requeueStaleProcessing(JobStatus.PENDING, JobStatus.PROCESSING,
                    startedBefore, error);
            int failed = jobRepository.failStaleProcessing(JobStatus.FAILED, JobStatus.PROCESSING, startedBefore,
                    now, error);
            return new ReapResult(requeued, failed);
        });
        if (result != null && result.total() > 0) {
            log.warn("Reaped {} stuck jobs started before {}: {} requeued, {} failed", result.total(),
                    startedBefore, result.requeued(), result.failed());
        }
        return result != null ? result : new ReapResult(0, 0);
    }

    /**
     * Status counts for jobs created in the last 24 hours plus per-type counts
     * of active jobs.
     */
    public QueueStats stats() {
        OffsetDateTime since = now().minus(STATS_WINDOW);
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobRepository.StatusCount row : jobRepository.countByStatusCreatedSince(since)) {
            byStatus.put(row.getStatus(), countOrZero(row.getJobCount()));
        }

        Map<JobType, long[]> activity = new EnumMap<>(JobType.class);
        for (JobRepository.TypeStatusCount row : jobRepository.countByTypeAndStatusIn(JobStatus.ACTIVE)) {
            long[] counts = activity.computeIfAbsent(row.getJobType(), ignored -> new long[2]);
            if (row.getStatus() == JobStatus.PENDING) {
                counts[0] = countOrZero(row.getJobCount());
            } else if (row.getStatus() == JobStatus.PROCESSING) {
                counts[1] = countOrZero(row.getJobCount());
            }
        }
        Map<JobType, QueueStats.TypeActivity> byType = new EnumMap<>(JobType.class);
        activity.forEach((type, counts) -> byType.put(type, new QueueStats.TypeActivity(counts[0], counts[1])));

        return new QueueStats(
                byStatus.getOrDefault(JobStatus.PENDING, 0L),
                byStatus.getOrDefault(JobStatus.PROCESSING, 0L),
                byStatus.getOrDefault(JobStatus.COMPLETED, 0L),
                byStatus.getOrDefault(JobStatus.FAILED, 0L),
                byStatus.getOrDefault(JobStatus.CANCELLED, 0L),
                byType);
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
