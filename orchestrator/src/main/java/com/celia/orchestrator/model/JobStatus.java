package com.celia.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a Job.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED
 *   PENDING → RUNNING → FAILED
 *   PENDING → FAILED   (job failed before the pipeline started)
 *
 * COMPLETED and FAILED are terminal. A status never moves backwards.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** True if a job currently in this status may move to {@code next}. */
    public boolean canTransitionTo(JobStatus next) {
        return predecessorsOf(next).contains(this);
    }

    /**
     * The statuses a job must currently be in to move to {@code target}.
     * Used as the guard of the store's conditional UPDATE.
     */
    public static Set<JobStatus> predecessorsOf(JobStatus target) {
        return switch (target) {
            case PENDING   -> EnumSet.noneOf(JobStatus.class);
            case RUNNING   -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.of(RUNNING);
            case FAILED    -> EnumSet.of(PENDING, RUNNING);
        };
    }

    /** Wire format: lower-case name ("pending", "running", ...). */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
