package com.celia.orchestrator.api.dto;

import com.celia.orchestrator.llm.UsageStats;
import com.celia.orchestrator.model.JobStatus;
import com.celia.orchestrator.service.PlatformStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body for GET /jobs/stats.
 */
public record StatsResponse(
        long              totalJobs,
        Map<String, Long> byStatus,
        UsageStats        usage,
        int               activeJobs,
        int               peakActiveJobs,
        int               availableSlots,
        int               maxConcurrent
) {
    public static StatsResponse from(PlatformStats stats) {
        // Every status is listed, zero counts included.
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (JobStatus s : JobStatus.values()) {
            byStatus.put(s.value(), stats.jobs().count(s));
        }
        return new StatsResponse(
                stats.jobs().totalJobs(),
                byStatus,
                stats.usage(),
                stats.activeJobs(),
                stats.peakActiveJobs(),
                stats.availableSlots(),
                stats.maxConcurrent()
        );
    }
}
