package com.celia.orchestrator.model;

import java.util.List;

/**
 * One step of an execution plan.
 *
 * @param stepNumber      unique within the plan
 * @param estimatedTime   free-form estimate from the planner, may be null
 * @param dependencies    step numbers this step depends on; informational only,
 *                        execution always follows plan order
 */
public record PlanStep(
        int          stepNumber,
        String       action,
        String       expectedOutcome,
        List<String> commands,
        String       estimatedTime,
        List<Integer> dependencies
) {
    public PlanStep {
        commands     = commands == null ? List.of() : List.copyOf(commands);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public PlanStep(int stepNumber, String action, String expectedOutcome, List<String> commands) {
        this(stepNumber, action, expectedOutcome, commands, null, List.of());
    }
}
