package com.celia.orchestrator.service;

import com.celia.orchestrator.llm.UsageStats;
import com.celia.orchestrator.model.JobStats;

/**
 * Point-in-time view of job counts, model usage and coordinator load.
 */
public record PlatformStats(
        JobStats   jobs,
        UsageStats usage,
        int        activeJobs,
        int        peakActiveJobs,
        int        availableSlots,
        int        maxConcurrent
) {}
