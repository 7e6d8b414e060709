package com.reelforge.jobs;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    /**
     * Row of a {@code GROUP BY status} aggregate.
     */
    interface StatusCount {
        JobStatus getStatus();

        Long getJobCount();
    }

    /**
     * Row of a {@code GROUP BY type, status} aggregate.
     */
    interface TypeStatusCount {
        JobType getJobType();

        JobStatus getStatus();

        Long getJobCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :pending
              AND j.scheduledFor <= :now
              AND j.attempts < j.maxAttempts
            ORDER BY j.priority DESC, j.scheduledFor ASC, j.sequence ASC
            """)
    List<Job> findClaimCandidates(@Param("pending") JobStatus pending, @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :pending
              AND j.type IN :types
              AND j.scheduledFor <= :now
              AND j.attempts < j.maxAttempts
            ORDER BY j.priority DESC, j.scheduledFor ASC, j.sequence ASC
            """)
    List<Job> findClaimCandidatesOfTypes(@Param("pending") JobStatus pending,
            @Param("types") Collection<JobType> types, @Param("now") OffsetDateTime now, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :cancelled,
                j.completedAt = :now
            WHERE j.id = :id
              AND j.status IN :active
            """)
    int markCancelled(@Param("id") UUID id, @Param("cancelled") JobStatus cancelled,
            @Param("active") Collection<JobStatus> active, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :pending,
                j.startedAt = NULL,
                j.error = :error
            WHERE j.status = :processing
              AND j.startedAt < :startedBefore
              AND j.attempts < j.maxAttempts
            """)
    int requeueStaleProcessing(@Param("pending") JobStatus pending, @Param("processing") JobStatus processing,
            @Param("startedBefore") OffsetDateTime startedBefore, @Param("error") String error);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :failed,
                j.completedAt = :now,
                j.error = :error
            WHERE j.status = :processing
              AND j.startedAt < :startedBefore
              AND j.attempts >= j.maxAttempts
            """)
    int failStaleProcessing(@Param("failed") JobStatus failed, @Param("processing") JobStatus processing,
            @Param("startedBefore") OffsetDateTime startedBefore, @Param("now") OffsetDateTime now,
            @Param("error") String error);

    @Modifying
    @Query("""
            DELETE FROM Job j
            WHERE j.status IN :terminal
              AND j.completedAt < :completedBefore
            """)
    int deleteTerminalCompletedBefore(@Param("terminal") Collection<JobStatus> terminal,
            @Param("completedBefore") OffsetDateTime completedBefore);

    @Query("""
            SELECT j.status AS status, COUNT(j) AS jobCount
            FROM Job j
            WHERE j.createdAt > :since
            GROUP BY j.status
            """)
    List<StatusCount> countByStatusCreatedSince(@Param("since") OffsetDateTime since);

    @Query("""
            SELECT j.type AS jobType, j.status AS status, COUNT(j) AS jobCount
            FROM Job j
            WHERE j.status IN :statuses
            GROUP BY j.type, j.status
            """)
    List<TypeStatusCount> countByTypeAndStatusIn(@Param("statuses") Collection<JobStatus> statuses);
}
