package com.celia.orchestrator.service;

import java.time.Duration;

/**
 * A job ran past its wall-clock budget and was cancelled.
 */
public class JobTimeoutException extends RuntimeException {

    private final Duration budget;

    public JobTimeoutException(Duration budget) {
        super("Job exceeded its execution budget of " + format(budget));
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }

    /** "10m", "90s", "1500ms". */
    static String format(Duration d) {
        if (d.toMillis() % 1000 != 0) return d.toMillis() + "ms";
        long seconds = d.toSeconds();
        if (seconds % 60 != 0 || seconds == 0) return seconds + "s";
        return (seconds / 60) + "m";
    }
}
