package com.celia.orchestrator.model;

import java.util.List;

/**
 * Ordered list of steps produced by the planning call.
 * Always holds at least one step.
 */
public record Plan(List<PlanStep> steps) {

    public static final String FALLBACK_ACTION  = "Manual Task Execution";
    public static final String FALLBACK_OUTCOME = "Goal reached";

    public Plan {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("A plan needs at least one step");
        }
        steps = List.copyOf(steps);
    }

    /** The single-step plan substituted when planning fails. */
    public static Plan fallback() {
        return new Plan(List.of(new PlanStep(1, FALLBACK_ACTION, FALLBACK_OUTCOME, List.of())));
    }

    public int size() {
        return steps.size();
    }
}
