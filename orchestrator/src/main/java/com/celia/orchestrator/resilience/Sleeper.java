package com.celia.orchestrator.resilience;

import java.time.Duration;

/**
 * Blocking pause used for backoff waits and simulated latency.
 * Tests substitute a recording implementation instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000));
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
