package com.celia.orchestrator.api.dto;

import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStatus;

import java.time.Instant;

/**
 * Response body for POST /jobs.
 * Contains enough information for the caller to poll job progress.
 */
public record JobResponse(
        String    id,
        JobStatus status,
        Instant   createdAt
) {
    public static JobResponse from(JobSnapshot job) {
        return new JobResponse(job.id(), job.status(), job.createdAt());
    }
}
