package com.celia.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window admission control for outbound calls.
 *
 * Keeps the admission times of the trailing window (one minute by default).
 * {@link #acquire()} blocks until one more admission would not exceed the
 * ceiling, then records it. Prune, check and record happen under one lock, so
 * threads from different jobs sharing this instance are never jointly admitted
 * above the ceiling. A waiter re-checks the freshly pruned window after every
 * wake-up instead of trusting the wait it computed before sleeping.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int  maxRequests;
    private final long windowNanos;

    private final ReentrantLock lock     = new ReentrantLock(true);
    private final Condition     released = lock.newCondition();
    private final Deque<Long>   admitted = new ArrayDeque<>();

    public RateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, DEFAULT_WINDOW);
    }

    public RateLimiter(int maxRequests, Duration window) {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be at least 1");
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
    }

    /**
     * Block until a request may be issued, then record the admission.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting;
     *                              no admission is recorded in that case
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                prune(now);
                if (admitted.size() < maxRequests) {
                    admitted.addLast(now);
                    return;
                }
                long waitNanos = admitted.peekFirst() + windowNanos - now;
                log.debug("Rate limit reached ({} per {}s), waiting {} ms",
                        maxRequests, TimeUnit.NANOSECONDS.toSeconds(windowNanos),
                        TimeUnit.NANOSECONDS.toMillis(waitNanos));
                released.awaitNanos(waitNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Number of admissions still inside the current window. */
    public int inFlightWindowCount() {
        lock.lock();
        try {
            prune(System.nanoTime());
            return admitted.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return Duration.ofNanos(windowNanos);
    }

    private void prune(long now) {
        while (!admitted.isEmpty() && now - admitted.peekFirst() >= windowNanos) {
            admitted.removeFirst();
        }
    }
}
