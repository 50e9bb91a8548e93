package com.celia.orchestrator.store;

import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStats;
import com.celia.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract the coordinator relies on.
 *
 * Each method is atomic for the single field it touches; there are no
 * cross-field transactions. Store failures surface as Spring's
 * {@code DataAccessException} and are not recovered by callers.
 */
public interface JobStore {

    /** Create a job in status PENDING with a "Job created" log line. */
    JobSnapshot create(String jobId, String task, String repoUrl);

    /**
     * Move the job forward to {@code status}.
     *
     * @return false if the job's current status does not allow the transition
     *         (the job is left untouched)
     * @throws JobNotFoundException if no such job exists
     */
    boolean updateStatus(String jobId, JobStatus status);

    /** Append one timestamp-prefixed line to the job log. */
    void appendLog(String jobId, String message);

    /** Append a file name unless already present; order of first insertion is kept. */
    void addFile(String jobId, String filename);

    /**
     * Mark the job FAILED with {@code message} and append an [ERROR] log line.
     *
     * @return false if the job had already reached a terminal status; the
     *         error is then neither recorded nor logged
     */
    boolean setError(String jobId, String message);

    Optional<JobSnapshot> get(String jobId);

    /** Most recently created first. */
    List<JobSnapshot> list(int limit);

    /** @return true if a job was deleted */
    boolean delete(String jobId);

    JobStats stats();

    /** Delete every job created before {@code cutoff}; returns the ids removed. */
    List<String> deleteCreatedBefore(Instant cutoff);
}
