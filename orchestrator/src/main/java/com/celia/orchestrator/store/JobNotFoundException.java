package com.celia.orchestrator.store;

/**
 * Thrown when a store operation names a job id that does not exist.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() { return jobId; }
}
