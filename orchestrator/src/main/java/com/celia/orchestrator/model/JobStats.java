package com.celia.orchestrator.model;

import java.util.Map;

/** Job counts, overall and per status. */
public record JobStats(long totalJobs, Map<JobStatus, Long> byStatus) {

    public JobStats {
        byStatus = Map.copyOf(byStatus);
    }

    public long count(JobStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
