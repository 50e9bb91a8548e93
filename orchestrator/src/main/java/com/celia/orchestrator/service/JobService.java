package com.celia.orchestrator.service;

import com.celia.orchestrator.llm.ResilientCallClient;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job submission, queries and housekeeping.
 *
 * Not @Transactional: each store call commits on its own, so the job row is
 * visible to the coordinator's threads before the job is dispatched.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT     = 500;
    static final int        MAX_REPO_URL_LENGTH = 2048;

    private final JobStore                store;
    private final JobExecutionCoordinator coordinator;
    private final ArtifactStore           artifacts;
    private final ResilientCallClient     callClient;
    private final JobProperties           properties;
    private final Clock                   clock;

    public JobService(JobStore store,
                      JobExecutionCoordinator coordinator,
                      ArtifactStore artifacts,
                      ResilientCallClient callClient,
                      JobProperties properties,
                      Clock clock) {
        this.store       = store;
        this.coordinator = coordinator;
        this.artifacts   = artifacts;
        this.callClient  = callClient;
        this.properties  = properties;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a job and hand it to the coordinator.
     *
     * @param repoUrl optional; blank is treated as absent
     * @return the new job, still PENDING; FAILED if it could not be handed off
     * @throws ValidationException if the task or repository reference is malformed
     */
    public JobSnapshot submit(String task, String repoUrl) {
        validateTask(task);
        String repo = normalizeRepoUrl(repoUrl);

        String jobId = UUID.randomUUID().toString();
        JobSnapshot job = store.create(jobId, task.strip(), repo);
        try {
            artifacts.prepare(jobId);
            coordinator.submit(jobId);
        } catch (RuntimeException e) {
            // The row is already committed; fail it so it does not sit in PENDING forever.
            log.error("Job {} could not be started", jobId, e);
            store.setError(jobId, "Job could not be started: " + e.getMessage());
            return store.get(jobId).orElse(job);
        }

        log.info("Job {} submitted (repo={})", jobId, repo);
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<JobSnapshot> findById(String jobId) {
        return store.get(jobId);
    }

    /**
     * @param limit null for the default; otherwise 1..{@value #MAX_LIST_LIMIT}
     */
    public List<JobSnapshot> list(Integer limit) {
        int n = limit == null ? DEFAULT_LIST_LIMIT : limit;
        if (n < 1 || n > MAX_LIST_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIST_LIMIT + ", got " + n);
        }
        return store.list(n);
    }

    public PlatformStats stats() {
        return new PlatformStats(
                store.stats(),
                callClient.usage(),
                coordinator.activeJobs(),
                coordinator.peakActiveJobs(),
                coordinator.availableSlots(),
                coordinator.maxConcurrent());
    }

    // ------------------------------------------------------------------
    // Deletion
    // ------------------------------------------------------------------

    /**
     * Delete the job and its artifacts.
     *
     * @return false if no such job exists
     */
    public boolean delete(String jobId) {
        if (!store.delete(jobId)) {
            return false;
        }
        artifacts.delete(jobId);
        log.info("Job {} deleted", jobId);
        return true;
    }

    /**
     * Delete every job created more than {@code retentionDays} days ago.
     *
     * @return number of jobs removed
     */
    public int cleanupOldJobs(int retentionDays) {
        if (retentionDays < 1) {
            throw new ValidationException("retentionDays must be positive, got " + retentionDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        List<String> removed = store.deleteCreatedBefore(cutoff);
        for (String jobId : removed) {
            try {
                artifacts.delete(jobId);
            } catch (ArtifactException e) {
                // Row is already gone; a leftover directory only costs disk space.
                log.warn("Could not delete artifacts of job {}, manual cleanup may be needed: {}",
                        jobId, e.getMessage());
            }
        }
        log.info("Retention cleanup removed {} job(s) created before {}", removed.size(), cutoff);
        return removed.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void validateTask(String task) {
        if (task == null || task.isBlank()) {
            throw new ValidationException("Task must not be empty");
        }
        if (task.length() > properties.getMaxTaskLength()) {
            throw new ValidationException("Task is %d characters (limit: %d)"
                    .formatted(task.length(), properties.getMaxTaskLength()));
        }
    }

    private static String normalizeRepoUrl(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            return null;
        }
        String repo = repoUrl.strip();
        if (repo.length() > MAX_REPO_URL_LENGTH) {
            throw new ValidationException("Repository URL is too long");
        }
        if (repo.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException("Repository URL must not contain whitespace");
        }
        return repo;
    }
}
