package com.celia.orchestrator.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Timing-based tests use a short window so they stay fast; bounds are
 * deliberately loose to tolerate scheduler jitter on CI machines.
 */
class RateLimiterTest {

    @Test
    void acquire_underCeiling_doesNotBlock() throws Exception {
        RateLimiter limiter = new RateLimiter(5, Duration.ofSeconds(10));

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(1000);
        assertThat(limiter.inFlightWindowCount()).isEqualTo(5);
    }

    @Test
    void acquire_overCeiling_waitsForOldestAdmissionToAgeOut() throws Exception {
        Duration window = Duration.ofMillis(300);
        RateLimiter limiter = new RateLimiter(2, window);

        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();   // third admission must wait for the first to leave the window
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(250);
    }

    @Test
    void acquire_concurrentCallers_neverJointlyAdmittedAboveCeiling() throws Exception {
        RateLimiter limiter = new RateLimiter(3, Duration.ofSeconds(2));
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < 6; i++) {
                pool.submit(() -> {
                    go.await();
                    limiter.acquire();
                    admitted.incrementAndGet();
                    return null;
                });
            }
            go.countDown();
            Thread.sleep(500);

            assertThat(admitted.get()).isEqualTo(3);
            assertThat(limiter.inFlightWindowCount()).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void acquire_interruptedWhileWaiting_throwsAndRecordsNothing() throws Exception {
        RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(30));
        limiter.acquire();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> blocked = pool.submit(() -> {
                limiter.acquire();
                return null;
            });
            Thread.sleep(100);
            blocked.cancel(true);
            pool.shutdown();

            assertThat(pool.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
            assertThat(limiter.inFlightWindowCount()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void constructor_rejectsNonPositiveCeiling() {
        assertThatThrownBy(() -> new RateLimiter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
