package com.reelforge.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "reelforge_jobs")
public class Job {

    @Id
    private UUID id;

    @Convert(converter = JobColumnConverters.TypeConverter.class)
    @Column(nullable = false, length = 50)
    private JobType type;

    @Convert(converter = JobColumnConverters.StatusConverter.class)
    @Column(nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    @Convert(converter = JobColumnConverters.PriorityConverter.class)
    @Column(nullable = false)
    private JobPriority priority = JobPriority.NORMAL;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode payload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    @Column(columnDefinition = "text")
    private String error;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 3;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "scheduled_for", nullable = false)
    private OffsetDateTime scheduledFor;

    // Assigned by the database identity on insert; breaks ordering ties.
    @Column(name = "seq", insertable = false, updatable = false)
    private Long sequence;

    protected Job() {
    }

    public Job(UUID id, JobType type, UUID ownerId, JsonNode payload, JobPriority priority, int maxAttempts,
            OffsetDateTime createdAt, OffsetDateTime scheduledFor) {
        this.id = id;
        this.type = type;
        this.ownerId = ownerId;
        this.payload = payload;
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.createdAt = createdAt;
        this.scheduledFor = scheduledFor;
    }

    /**
     * Moves a pending job into processing for a new attempt.
     */
    void markClaimed(OffsetDateTime now) {
        this.status = JobStatus.PROCESSING;
        this.startedAt = now;
        this.attempts++;
    }

    void markCompleted(JsonNode result, OffsetDateTime now) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.error = null;
        this.completedAt = now;
    }

    void markRetryable(String error, OffsetDateTime nextScheduledFor) {
        this.status = JobStatus.PENDING;
        this.error = error;
        this.startedAt = null;
        if (nextScheduledFor != null) {
            this.scheduledFor = nextScheduledFor;
        }
    }

    void markFailed(String error, OffsetDateTime now) {
        this.status = JobStatus.FAILED;
        this.error = error;
        this.completedAt = now;
    }

    @Transient
    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }

    @Transient
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public UUID getId() {
        return id;
    }

    public JobType getType() {
        return type;
    }

    public JobStatus getStatus() {
        return status;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public JsonNode getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public OffsetDateTime getScheduledFor() {
        return scheduledFor;
    }

    public Long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", type=" + type + ", status=" + status + ", priority=" + priority
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
