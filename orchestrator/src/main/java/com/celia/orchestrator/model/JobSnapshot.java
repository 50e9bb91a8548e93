package com.celia.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a Job as read from the store.
 * Safe to hand across threads and to the web layer.
 */
public record JobSnapshot(
        String       id,
        String       task,
        String       repoUrl,
        JobStatus    status,
        String       logs,
        List<String> files,
        String       error,
        Instant      createdAt,
        Instant      updatedAt
) {
    public JobSnapshot {
        files = files == null ? List.of() : List.copyOf(files);
        logs  = logs == null ? "" : logs;
    }

    public static JobSnapshot from(Job job) {
        return new JobSnapshot(
                job.getId(),
                job.getTask(),
                job.getRepoUrl(),
                job.getStatus(),
                job.getLogs(),
                job.getFiles(),
                job.getError(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }

    public boolean hasRepository() {
        return repoUrl != null && !repoUrl.isBlank();
    }
}
