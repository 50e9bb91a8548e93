package com.celia.orchestrator.agent;

import com.celia.orchestrator.model.Plan;

/**
 * @param failureReason why the fallback plan was substituted; null for generated plans
 */
public record PlanResult(Plan plan, ResultSource source, String failureReason) {

    public static PlanResult generated(Plan plan) {
        return new PlanResult(plan, ResultSource.GENERATED, null);
    }

    public static PlanResult fallback(String reason) {
        return new PlanResult(Plan.fallback(), ResultSource.FALLBACK, reason);
    }

    public boolean isFallback() {
        return source == ResultSource.FALLBACK;
    }
}
