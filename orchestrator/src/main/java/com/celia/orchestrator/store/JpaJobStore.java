package com.celia.orchestrator.store;

import com.celia.orchestrator.model.Job;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStats;
import com.celia.orchestrator.model.JobStatus;
import com.celia.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JobStore backed by Spring Data JPA (PostgreSQL in production).
 *
 * Every method runs in its own transaction. Status, error and log writes are
 * single conditional UPDATEs; the file list is appended under a row lock.
 */
@Component
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository jobRepo;
    private final Clock         clock;

    public JpaJobStore(JobRepository jobRepo, Clock clock) {
        this.jobRepo = jobRepo;
        this.clock   = clock;
    }

    @Override
    @Transactional
    public JobSnapshot create(String jobId, String task, String repoUrl) {
        Job job = new Job(jobId, task, repoUrl, clock.instant());
        job.setLogs(LogLines.format(clock, "Job created"));
        return JobSnapshot.from(jobRepo.save(job));
    }

    @Override
    @Transactional
    public boolean updateStatus(String jobId, JobStatus status) {
        int changed = jobRepo.transitionStatus(
                jobId, JobStatus.predecessorsOf(status), status, clock.instant());
        if (changed == 0) {
            Job current = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            log.warn("Rejected status change for job {}: {} → {}", jobId, current.getStatus(), status);
            return false;
        }
        return true;
    }

    @Override
    @Transactional
    public void appendLog(String jobId, String message) {
        if (jobRepo.appendLog(jobId, LogLines.format(clock, message), clock.instant()) == 0) {
            throw new JobNotFoundException(jobId);
        }
    }

    @Override
    @Transactional
    public void addFile(String jobId, String filename) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.getFiles().contains(filename)) {
            job.getFiles().add(filename);
            job.setUpdatedAt(clock.instant());
        }
    }

    @Override
    @Transactional
    public boolean setError(String jobId, String message) {
        int changed = jobRepo.markFailed(jobId, JobStatus.predecessorsOf(JobStatus.FAILED),
                JobStatus.FAILED, message, clock.instant());
        if (changed == 0) {
            Job current = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            log.warn("Job {} already {}, not recording error: {}", jobId, current.getStatus(), message);
            return false;
        }
        jobRepo.appendLog(jobId, LogLines.format(clock, "[ERROR] " + message), clock.instant());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobSnapshot> get(String jobId) {
        return jobRepo.findById(jobId).map(JobSnapshot::from);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobSnapshot> list(int limit) {
        return jobRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit)).stream()
                .map(JobSnapshot::from)
                .toList();
    }

    @Override
    @Transactional
    public boolean delete(String jobId) {
        return jobRepo.findById(jobId)
                .map(job -> {
                    jobRepo.delete(job);
                    return true;
                })
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public JobStats stats() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        long total = 0;
        for (JobRepository.StatusCount row : jobRepo.countByStatus()) {
            byStatus.put(row.getStatus(), row.getTotal());
            total += row.getTotal();
        }
        return new JobStats(total, byStatus);
    }

    @Override
    @Transactional
    public List<String> deleteCreatedBefore(Instant cutoff) {
        List<Job> expired = jobRepo.findByCreatedAtBefore(cutoff);
        jobRepo.deleteAll(expired);
        return expired.stream().map(Job::getId).toList();
    }
}
