package com.celia.orchestrator.llm;

/** Cumulative counters for outbound generation calls since startup. */
public record UsageStats(
        long totalRequests,
        long failedRequests,
        long inputTokens,
        long outputTokens,
        long cacheHits
) {}
