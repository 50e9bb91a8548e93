package com.celia.orchestrator.repository;

import com.celia.orchestrator.model.Job;
import com.celia.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + per-field atomic updates for the jobs table.
 *
 * Status and log changes are single UPDATE statements so two writers
 * (e.g. a cancelled pipeline and the coordinator recording a timeout)
 * can never interleave a read-modify-write on the same row.
 */
public interface JobRepository extends JpaRepository<Job, String> {

    /**
     * Move a job to {@code next} only if it is currently in one of {@code from}.
     * Returns the number of rows changed (0 or 1).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :next, j.updatedAt = :now
            WHERE j.id = :id AND j.status IN :from
            """)
    int transitionStatus(@Param("id") String id,
                         @Param("from") Collection<JobStatus> from,
                         @Param("next") JobStatus next,
                         @Param("now") Instant now);

    /** Same guard as {@link #transitionStatus}, recording the error message as well. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.status = :failed, j.error = :error, j.updatedAt = :now
            WHERE j.id = :id AND j.status IN :from
            """)
    int markFailed(@Param("id") String id,
                   @Param("from") Collection<JobStatus> from,
                   @Param("failed") JobStatus failed,
                   @Param("error") String error,
                   @Param("now") Instant now);

    /** Append to the log in the database; the existing text is never read back or rewritten. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.logs = CONCAT(j.logs, :line), j.updatedAt = :now
            WHERE j.id = :id
            """)
    int appendLog(@Param("id") String id, @Param("line") String line, @Param("now") Instant now);

    /** Row-locked read used when appending to the file list. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") String id);

    /** Newest first; the page size is the list limit. */
    List<Job> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Job> findByCreatedAtBefore(Instant cutoff);

    @Query("SELECT j.status AS status, COUNT(j) AS total FROM Job j GROUP BY j.status")
    List<StatusCount> countByStatus();

    /** Projection row for {@link #countByStatus()}. */
    interface StatusCount {
        JobStatus getStatus();
        long getTotal();
    }
}
