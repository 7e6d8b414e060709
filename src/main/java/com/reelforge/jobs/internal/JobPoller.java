package com.reelforge.jobs.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelforge.config.ReelForgeProperties;
import com.reelforge.jobs.Job;
import com.reelforge.jobs.JobQueue;
import com.reelforge.jobs.JobType;
import com.reelforge.jobs.JobWorker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker loop for {@link JobWorker} beans: on every tick it claims jobs of the
 * registered types while processing slots are free, runs them on a bounded
 * pool and reports the outcome back to the queue.
 */
@Component
@ConditionalOnProperty(prefix = "reelforge.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final JobQueue jobQueue;
    private final List<JobWorker<?>> workers;
    private final ObjectMapper objectMapper;
    private final ReelForgeProperties properties;
    private final int workerCount;
    private final ThreadPoolExecutor processingExecutor;
    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

    private Map<JobType, JobWorker<?>> workersByType = Map.of();

    public JobPoller(JobQueue jobQueue, List<JobWorker<?>> workers, ObjectMapper objectMapper,
            ReelForgeProperties properties) {
        this.jobQueue = jobQueue;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.workerCount = Math.max(1, properties.getWorker().getWorkerCount());

        int processingQueueCapacity = Math.max(32, workerCount * 8);
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @PostConstruct
    public void init() {
        Map<JobType, JobWorker<?>> registrations = new EnumMap<>(JobType.class);
        for (JobWorker<?> worker : workers) {
            JobType type = worker.getJobType();
            if (type == null) {
                throw new IllegalStateException("JobWorker " + ClassUtils.getUserClass(worker).getName()
                        + " must declare a job type");
            }
            JobWorker<?> existing = registrations.putIfAbsent(type, worker);
            if (existing != null) {
                throw new IllegalStateException("Duplicate worker for job type '" + type.getCode() + "': "
                        + ClassUtils.getUserClass(existing).getName() + " and "
                        + ClassUtils.getUserClass(worker).getName());
            }
        }
        this.workersByType = Map.copyOf(registrations);
        log.info("Job poller initialized with {} worker(s) for types {}", workersByType.size(), workersByType.keySet());
    }

    @Scheduled(fixedDelayString = "${reelforge.worker.poll-interval-in-seconds:5}000")
    public void poll() {
        if (workersByType.isEmpty() || !pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            Set<JobType> types = workersByType.keySet();
            while (availableProcessingSlots() > 0) {
                Optional<Job> claimed = jobQueue.claim(types);
                if (claimed.isEmpty()) {
                    break;
                }
                Job job = claimed.get();
                processingExecutor.execute(() -> processJob(job));
            }
        } catch (Exception e) {
            log.error("Job poll tick failed", e);
        } finally {
            pollInProgress.set(false);
        }
    }

    int availableProcessingSlots() {
        int inFlight = processingExecutor.getActiveCount() + processingExecutor.getQueue().size();
        return workerCount - inFlight;
    }

    void processJob(Job job) {
        @SuppressWarnings("unchecked")
        JobWorker<Object> worker = (JobWorker<Object>) workersByType.get(job.getType());
        if (worker == null) {
            jobQueue.fail(job.getId(), job.getAttempts(), "No worker registered for type " + job.getType().getCode(),
                    true, null);
            return;
        }

        Object payload = null;
        try {
            payload = deserialize(job.getPayload(), worker.getPayloadClass());
            Object result = worker.process(job, payload);
            jobQueue.complete(job.getId(), job.getAttempts(), result);
            log.debug("Successfully processed job {} of type {}", job.getId(), job.getType().getCode());
        } catch (Exception e) {
            invokeOnErrorSafely(worker, job, payload, e);
            log.error("Failed to process job {} of type {} (attempt {}/{})", job.getId(), job.getType().getCode(),
                    job.getAttempts(), job.getMaxAttempts(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            jobQueue.fail(job.getId(), job.getAttempts(), message, true, retryDelayFor(job.getAttempts()));
        }
    }

    Duration retryDelayFor(int attempts) {
        Duration initial = Durations.parse(properties.getJobs().getInitialBackoff());
        if (initial.isZero() || initial.isNegative()) {
            return Duration.ZERO;
        }
        Duration max = Durations.parse(properties.getJobs().getMaxBackoff());
        double factor = Math.pow(properties.getJobs().getBackoffMultiplier(), Math.max(0, attempts - 1));
        double delayMillis = initial.toMillis() * factor;
        if (Double.isNaN(delayMillis) || delayMillis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) delayMillis);
    }

    private Object deserialize(JsonNode payload, Class<?> payloadClass) throws Exception {
        if (payload == null || payload.isNull()) {
            return null;
        }
        if (payloadClass == JsonNode.class) {
            return payload;
        }
        return objectMapper.treeToValue(payload, payloadClass);
    }

    private void invokeOnErrorSafely(JobWorker<Object> worker, Job job, Object payload, Exception error) {
        try {
            worker.onError(job, payload, error);
        } catch (Exception onErrorFailure) {
            log.error("onError callback failed for job {} of type {}", job.getId(), job.getType().getCode(),
                    onErrorFailure);
        }
    }

    @PreDestroy
    void shutdownExecutor() {
        processingExecutor.shutdown();
    }
}
