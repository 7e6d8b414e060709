package com.reelforge.jobs;

import com.reelforge.PostgresTestSupport;
import com.reelforge.TestApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = TestApplication.class)
@ActiveProfiles("test")
@Testcontainers
class JobQueueIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = PostgresTestSupport.newContainer();

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        PostgresTestSupport.register(registry, postgres);
    }

    @Autowired
    JobQueue jobQueue;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    TransactionTemplate transactionTemplate;

    UUID owner;

    @BeforeEach
    void resetQueue() {
        jdbcTemplate.update("DELETE FROM reelforge_jobs");
        owner = PostgresTestSupport.insertAccount(jdbcTemplate, 100);
    }

    @Test
    void shouldCreateJobsTableAndDispatchIndex() {
        List<String> columns = jdbcTemplate.queryForList(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'reelforge_jobs'",
                String.class);
        assertTrue(columns.containsAll(List.of("id", "type", "status", "priority", "owner_id", "payload", "result",
                "error", "attempts", "max_attempts", "created_at", "started_at", "completed_at", "scheduled_for")));

        Integer indexCount = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM pg_indexes WHERE tablename = 'reelforge_jobs' "
                        + "AND indexname = 'idx_reelforge_jobs_pending_dispatch'",
                Integer.class);
        assertEquals(1, indexCount);
    }

    @Test
    void shouldCreatePendingJobWithDefaults() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, Map.of("prompt", "a red fox"));

        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(JobPriority.NORMAL, stored.getPriority());
        assertEquals(0, stored.getAttempts());
        assertEquals(3, stored.getMaxAttempts());
        assertEquals("a red fox", stored.getPayload().get("prompt").asText());
        assertNotNull(stored.getScheduledFor());
        assertNull(stored.getStartedAt());
        assertNull(stored.getCompletedAt());
    }

    @Test
    void shouldAcceptWireTypeCode() {
        Job job = jobQueue.create("story_expansion", owner, Map.of("outline", "three acts"));

        assertEquals(JobType.STORY_EXPANSION, jobQueue.getJob(job.getId()).orElseThrow().getType());
    }

    @Test
    void shouldRejectJobForUnknownOwner() {
        assertThrows(JobValidationException.class,
                () -> jobQueue.create(JobType.VIDEO_GENERATION, UUID.randomUUID(), Map.of("prompt", "x")));
        assertEquals(0, jdbcTemplate.queryForObject("SELECT count(*) FROM reelforge_jobs", Integer.class));
    }

    @Test
    void shouldRejectUnknownOwnerInsideCallerTransaction() {
        JobValidationException error = assertThrows(JobValidationException.class,
                () -> transactionTemplate.executeWithoutResult(status -> {
                    jobQueue.create(JobType.IMAGE_GENERATION, owner, Map.of("prompt", "kept?"));
                    jobQueue.create(JobType.VIDEO_GENERATION, UUID.randomUUID(), Map.of("prompt", "x"));
                }));

        assertInstanceOf(DataIntegrityViolationException.class, error.getCause());
        assertEquals(0, jdbcTemplate.queryForObject("SELECT count(*) FROM reelforge_jobs", Integer.class));
    }

    @Test
    void shouldClaimByPriorityThenScheduleThenInsertionOrder() {
        OffsetDateTime past = OffsetDateTime.now(ZoneOffset.UTC).minusMinutes(10);
        Job low = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.LOW, 3, past);
        Job normalFirst = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.NORMAL, 3, past);
        Job normalSecond = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.NORMAL, 3, past);
        Job normalEarlier = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.NORMAL, 3,
                past.minusMinutes(5));
        Job urgent = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.URGENT, 3, past);

        List<UUID> claimOrder = new ArrayList<>();
        Optional<Job> next;
        while ((next = jobQueue.claim()).isPresent()) {
            claimOrder.add(next.get().getId());
        }

        assertEquals(List.of(urgent.getId(), normalEarlier.getId(), normalFirst.getId(), normalSecond.getId(),
                low.getId()), claimOrder);
    }

    @Test
    void shouldMarkClaimedJobAsProcessing() {
        Job job = jobQueue.create(JobType.MUSIC_GENERATION, owner, Map.of("genre", "lofi"));

        Job claimed = jobQueue.claim().orElseThrow();

        assertEquals(job.getId(), claimed.getId());
        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.getStatus());
        assertEquals(1, stored.getAttempts());
        assertNotNull(stored.getStartedAt());
    }

    @Test
    void shouldOnlyClaimRequestedTypes() {
        jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.URGENT);
        Job video = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.LOW);

        Job claimed = jobQueue.claim(List.of(JobType.VIDEO_GENERATION)).orElseThrow();

        assertEquals(video.getId(), claimed.getId());
        assertTrue(jobQueue.claim(List.of(JobType.VIDEO_GENERATION)).isEmpty());
    }

    @Test
    void shouldNotClaimJobBeforeItsScheduledTime() {
        jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.URGENT, 3,
                OffsetDateTime.now(ZoneOffset.UTC).plusHours(1));

        assertTrue(jobQueue.claim().isEmpty());
    }

    @Test
    void shouldNeverHandTheSameJobToTwoClaimants() throws Exception {
        int jobCount = 40;
        for (int i = 0; i < jobCount; i++) {
            jobQueue.create(JobType.IMAGE_GENERATION, owner, Map.of("index", i));
        }

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<UUID> claimed = new ConcurrentLinkedQueue<>();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    Optional<Job> next;
                    while ((next = jobQueue.claim()).isPresent()) {
                        claimed.add(next.get().getId());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Set<UUID> unique = new HashSet<>(claimed);
        assertEquals(jobCount, claimed.size());
        assertEquals(jobCount, unique.size());
        assertEquals(jobCount, jdbcTemplate.queryForObject(
                "SELECT count(*) FROM reelforge_jobs WHERE status = 'processing' AND attempts = 1", Integer.class));
    }

    @Test
    void shouldRetryUntilAttemptsAreExhausted() {
        Job job = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.NORMAL, 2, null);

        jobQueue.claim().orElseThrow();
        assertEquals(Optional.of(JobStatus.PENDING), jobQueue.fail(job.getId(), "provider timeout", true));
        Job afterFirst = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(1, afterFirst.getAttempts());
        assertEquals("provider timeout", afterFirst.getError());
        assertNull(afterFirst.getStartedAt());

        jobQueue.claim().orElseThrow();
        assertEquals(Optional.of(JobStatus.FAILED), jobQueue.fail(job.getId(), "provider timeout again", true));

        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals(2, stored.getAttempts());
        assertEquals("provider timeout again", stored.getError());
        assertNotNull(stored.getCompletedAt());
        assertTrue(jobQueue.claim().isEmpty());
    }

    @Test
    void shouldFailImmediatelyWhenRetryIsNotRequested() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();

        assertEquals(Optional.of(JobStatus.FAILED), jobQueue.fail(job.getId(), "content policy", false));
        assertEquals(1, jobQueue.getJob(job.getId()).orElseThrow().getAttempts());
    }

    @Test
    void shouldDelayRetryWhenRetryDelayGiven() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();

        assertEquals(Optional.of(JobStatus.PENDING), jobQueue.fail(job.getId(), "rate limited", Duration.ofHours(1)));

        assertTrue(jobQueue.claim().isEmpty());
        assertTrue(jobQueue.getJob(job.getId()).orElseThrow().getScheduledFor()
                .isAfter(OffsetDateTime.now(ZoneOffset.UTC).plusMinutes(30)));
    }

    @Test
    void shouldIgnoreFailureOfJobThatIsNotProcessing() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);

        assertTrue(jobQueue.fail(job.getId(), "boom", true).isEmpty());
        assertTrue(jobQueue.fail(UUID.randomUUID(), "boom", true).isEmpty());
        assertEquals(JobStatus.PENDING, jobQueue.getJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void shouldStoreResultOnCompletion() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();

        assertTrue(jobQueue.complete(job.getId(), Map.of("url", "https://cdn.example/fox.png")));

        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals("https://cdn.example/fox.png", stored.getResult().get("url").asText());
        assertNotNull(stored.getCompletedAt());

        assertFalse(jobQueue.cancel(job.getId()));
        Job afterCancel = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, afterCancel.getStatus());
        assertEquals(stored.getCompletedAt(), afterCancel.getCompletedAt());
    }

    @Test
    void shouldKeepCancelledJobCancelled() {
        Job job = jobQueue.create(JobType.VIDEO_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();

        assertTrue(jobQueue.cancel(job.getId()));
        assertFalse(jobQueue.cancel(job.getId()));
        assertFalse(jobQueue.complete(job.getId(), Map.of("url", "late")));
        assertTrue(jobQueue.fail(job.getId(), "late failure", true).isEmpty());

        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, stored.getStatus());
        assertNull(stored.getResult());
        assertNotNull(stored.getCompletedAt());
    }

    @Test
    void shouldNotClaimCancelledPendingJob() {
        Job job = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);

        assertTrue(jobQueue.cancel(job.getId()));

        assertTrue(jobQueue.claim().isEmpty());
        assertFalse(jobQueue.cancel(UUID.randomUUID()));
    }

    @Test
    void shouldCleanupOnlyOldTerminalJobs() {
        Job oldCompleted = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();
        jobQueue.complete(oldCompleted.getId(), null);
        Job oldCancelled = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.cancel(oldCancelled.getId());
        Job recentCompleted = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.claim().orElseThrow();
        jobQueue.complete(recentCompleted.getId(), null);
        Job oldPending = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);

        jdbcTemplate.update("UPDATE reelforge_jobs SET completed_at = NOW() - INTERVAL '40 days' WHERE id IN (?, ?)",
                oldCompleted.getId(), oldCancelled.getId());
        jdbcTemplate.update("UPDATE reelforge_jobs SET created_at = NOW() - INTERVAL '90 days' WHERE id = ?",
                oldPending.getId());

        assertEquals(2, jobQueue.cleanup(30));

        assertTrue(jobQueue.getJob(oldCompleted.getId()).isEmpty());
        assertTrue(jobQueue.getJob(oldCancelled.getId()).isEmpty());
        assertTrue(jobQueue.getJob(recentCompleted.getId()).isPresent());
        assertTrue(jobQueue.getJob(oldPending.getId()).isPresent());
        assertThrows(IllegalArgumentException.class, () -> jobQueue.cleanup(-1));
    }

    @Test
    void shouldRequeueOrFailStuckJobs() {
        Job retryable = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.HIGH, 3, null);
        Job exhausted = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.NORMAL, 1, null);
        Job fresh = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.LOW, 3, null);
        jobQueue.claim().orElseThrow();
        jobQueue.claim().orElseThrow();
        jobQueue.claim().orElseThrow();
        jdbcTemplate.update("UPDATE reelforge_jobs SET started_at = NOW() - INTERVAL '2 hours' WHERE id IN (?, ?)",
                retryable.getId(), exhausted.getId());

        ReapResult result = jobQueue.requeueStuckJobs(Duration.ofMinutes(30));

        assertEquals(1, result.requeued());
        assertEquals(1, result.failed());
        Job requeued = jobQueue.getJob(retryable.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, requeued.getStatus());
        assertNull(requeued.getStartedAt());
        assertEquals(JobStatus.FAILED, jobQueue.getJob(exhausted.getId()).orElseThrow().getStatus());
        assertEquals(JobStatus.PROCESSING, jobQueue.getJob(fresh.getId()).orElseThrow().getStatus());
        assertEquals(retryable.getId(), jobQueue.claim().orElseThrow().getId());
    }

    @Test
    void shouldRejectOutcomeFromReapedAttemptAfterReclaim() {
        Job job = jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.NORMAL, 3, null);
        Job firstAttempt = jobQueue.claim().orElseThrow();
        jdbcTemplate.update("UPDATE reelforge_jobs SET started_at = NOW() - INTERVAL '2 hours' WHERE id = ?",
                job.getId());
        assertEquals(1, jobQueue.requeueStuckJobs(Duration.ofMinutes(30)).requeued());
        Job secondAttempt = jobQueue.claim().orElseThrow();
        assertEquals(1, firstAttempt.getAttempts());
        assertEquals(2, secondAttempt.getAttempts());

        assertFalse(jobQueue.complete(job.getId(), firstAttempt.getAttempts(), Map.of("from", "first worker")));
        assertTrue(jobQueue.fail(job.getId(), firstAttempt.getAttempts(), "late failure", true, null).isEmpty());

        Job stored = jobQueue.getJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.getStatus());
        assertEquals(2, stored.getAttempts());
        assertNull(stored.getResult());

        assertTrue(jobQueue.complete(job.getId(), secondAttempt.getAttempts(), Map.of("from", "second worker")));
        assertEquals("second worker", jobQueue.getJob(job.getId()).orElseThrow().getResult().get("from").asText());
    }

    @Test
    void shouldReportStatsForRecentJobs() {
        Job completed = jobQueue.create(JobType.IMAGE_GENERATION, owner, null, JobPriority.URGENT);
        jobQueue.claim().orElseThrow();
        jobQueue.complete(completed.getId(), null);
        jobQueue.create(JobType.VIDEO_GENERATION, owner, null, JobPriority.URGENT);
        jobQueue.claim().orElseThrow();
        jobQueue.create(JobType.VIDEO_GENERATION, owner, null);
        jobQueue.create(JobType.VIDEO_GENERATION, owner, null);
        Job cancelled = jobQueue.create(JobType.MUSIC_GENERATION, owner, null);
        jobQueue.cancel(cancelled.getId());
        Job old = jobQueue.create(JobType.STORY_EXPANSION, owner, null);
        jdbcTemplate.update("UPDATE reelforge_jobs SET created_at = NOW() - INTERVAL '2 days' WHERE id = ?",
                old.getId());

        QueueStats stats = jobQueue.stats();

        assertEquals(2, stats.pending());
        assertEquals(1, stats.processing());
        assertEquals(1, stats.completed());
        assertEquals(0, stats.failed());
        assertEquals(1, stats.cancelled());
        assertEquals(new QueueStats.TypeActivity(2, 1), stats.byType().get(JobType.VIDEO_GENERATION));
        assertEquals(new QueueStats.TypeActivity(1, 0), stats.byType().get(JobType.STORY_EXPANSION));
        assertNull(stats.byType().get(JobType.IMAGE_GENERATION));
    }

    @Test
    void shouldListOwnerJobsNewestFirstWithFilters() {
        UUID otherOwner = PostgresTestSupport.insertAccount(jdbcTemplate, 100);
        Job first = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        Job second = jobQueue.create(JobType.VIDEO_GENERATION, owner, null);
        Job third = jobQueue.create(JobType.IMAGE_GENERATION, owner, null);
        jobQueue.create(JobType.IMAGE_GENERATION, otherOwner, null);
        jobQueue.cancel(third.getId());
        jdbcTemplate.update("UPDATE reelforge_jobs SET created_at = NOW() - INTERVAL '3 minutes' WHERE id = ?",
                first.getId());
        jdbcTemplate.update("UPDATE reelforge_jobs SET created_at = NOW() - INTERVAL '2 minutes' WHERE id = ?",
                second.getId());
        jdbcTemplate.update("UPDATE reelforge_jobs SET created_at = NOW() - INTERVAL '1 minutes' WHERE id = ?",
                third.getId());

        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
                jobQueue.listJobsForOwner(owner).stream().map(Job::getId).toList());
        assertEquals(List.of(third.getId(), first.getId()),
                jobQueue.listJobsForOwner(owner, null, JobType.IMAGE_GENERATION, 10).stream().map(Job::getId)
                        .toList());
        assertEquals(List.of(first.getId()),
                jobQueue.listJobsForOwner(owner, JobStatus.PENDING, JobType.IMAGE_GENERATION, 10).stream()
                        .map(Job::getId).toList());
        assertEquals(1, jobQueue.listJobsForOwner(owner, null, null, 1).size());
        assertThrows(IllegalArgumentException.class, () -> jobQueue.listJobsForOwner(owner, null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> jobQueue.listJobsForOwner(owner, null, null, 101));
    }
}
