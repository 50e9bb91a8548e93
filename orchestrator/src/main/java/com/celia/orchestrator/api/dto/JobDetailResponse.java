package com.celia.orchestrator.api.dto;

import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * Full view of a job returned by GET /jobs and GET /jobs/{id}.
 * {@code files} can be fetched through GET /jobs/{id}/download/{filename}.
 */
public record JobDetailResponse(
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
    public static JobDetailResponse from(JobSnapshot job) {
        return new JobDetailResponse(
                job.id(),
                job.task(),
                job.repoUrl(),
                job.status(),
                job.logs(),
                job.files(),
                job.error(),
                job.createdAt(),
                job.updatedAt()
        );
    }
}
