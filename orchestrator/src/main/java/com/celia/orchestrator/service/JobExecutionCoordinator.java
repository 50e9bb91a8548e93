package com.celia.orchestrator.service;

import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStatus;
import com.celia.orchestrator.store.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs jobs with bounded concurrency and a per-job wall-clock budget.
 *
 * A fair semaphore hands out {@code maxConcurrent} slots in arrival order.
 * Each admitted job runs its {@link JobPipeline} on a pipeline thread while the
 * dispatch thread waits up to the timeout; on expiry the pipeline thread is
 * interrupted and the job is marked FAILED. Late status writes from a cancelled
 * pipeline are rejected by the store, so the failure sticks.
 *
 * The slot of a timed-out job is held until its pipeline thread has actually
 * stopped, or until {@code cancelGrace} runs out. Only a pipeline blocked in a
 * call that ignores interrupts for longer than that can overlap the next job.
 *
 * Gauges: {@code celia.jobs.active}, {@code celia.jobs.available-slots}.
 * Timer:  {@code celia.jobs.duration{status}}.
 */
@Component
public class JobExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(JobExecutionCoordinator.class);

    static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(5);

    private final JobPipeline   pipeline;
    private final JobStore      store;
    private final Semaphore     slots;
    private final int           maxConcurrent;
    private final Duration      timeout;
    private final Duration      cancelGrace;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak   = new AtomicInteger();

    // Dispatch threads mostly wait (for a slot, then for the pipeline).
    private final ExecutorService dispatchPool = Executors.newCachedThreadPool(named("job-dispatch-"));
    private final ExecutorService pipelinePool = Executors.newCachedThreadPool(named("job-pipeline-"));

    @Autowired
    public JobExecutionCoordinator(JobPipeline pipeline,
                                   JobStore store,
                                   JobProperties properties,
                                   MeterRegistry meterRegistry) {
        this(pipeline, store, properties.getMaxConcurrent(), properties.getTimeout(),
                properties.getCancelGrace(), meterRegistry);
    }

    public JobExecutionCoordinator(JobPipeline pipeline,
                                   JobStore store,
                                   int maxConcurrent,
                                   Duration timeout,
                                   MeterRegistry meterRegistry) {
        this(pipeline, store, maxConcurrent, timeout, DEFAULT_CANCEL_GRACE, meterRegistry);
    }

    public JobExecutionCoordinator(JobPipeline pipeline,
                                   JobStore store,
                                   int maxConcurrent,
                                   Duration timeout,
                                   Duration cancelGrace,
                                   MeterRegistry meterRegistry) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.pipeline      = pipeline;
        this.store         = store;
        this.maxConcurrent = maxConcurrent;
        this.slots         = new Semaphore(maxConcurrent, true);
        this.timeout       = timeout;
        this.cancelGrace   = cancelGrace;
        this.meterRegistry = meterRegistry;

        Gauge.builder("celia.jobs.active", active, AtomicInteger::get)
                .description("Jobs currently holding an execution slot")
                .register(meterRegistry);
        Gauge.builder("celia.jobs.available-slots", slots, Semaphore::availablePermits)
                .register(meterRegistry);
        log.info("Job coordinator ready: {} slot(s), timeout {}", maxConcurrent, timeout);
    }

    /**
     * Dispatch {@link #execute} on a background thread.
     *
     * @return completes with the job's final status; completes exceptionally only
     *         if the store itself failed while recording the outcome
     */
    public CompletableFuture<JobStatus> submit(String jobId) {
        CompletableFuture<JobStatus> result = new CompletableFuture<>();
        dispatchPool.execute(() -> {
            try {
                result.complete(execute(jobId));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            } catch (RuntimeException e) {
                log.error("Could not record outcome of job {}: {}", jobId, e.getMessage(), e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Run one job to a terminal status, blocking until it finishes or times out.
     * Waits for a free slot first.
     */
    public JobStatus execute(String jobId) throws InterruptedException {
        slots.acquire();
        int now = active.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        long started = System.nanoTime();
        JobStatus finalStatus = JobStatus.FAILED;
        try {
            log.info("Job {} admitted ({} active, {} slot(s) free)", jobId, now, slots.availablePermits());
            CountDownLatch stopped = new CountDownLatch(1);
            Future<JobStatus> run = pipelinePool.submit(() -> {
                try {
                    return pipeline.run(jobId);
                } finally {
                    stopped.countDown();
                }
            });
            try {
                finalStatus = run.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                run.cancel(true);
                JobTimeoutException timeoutError = new JobTimeoutException(timeout);
                log.error("Job {} timed out after {}", jobId, timeout);
                finalStatus = fail(jobId, timeoutError.getMessage());
                awaitStop(jobId, stopped);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.error("Job {} failed: {}", jobId, cause.getMessage(), cause);
                finalStatus = fail(jobId, "Fatal error in execution loop: " + cause.getMessage());
            } catch (InterruptedException e) {
                run.cancel(true);
                finalStatus = fail(jobId, "Job interrupted during shutdown");
                throw e;
            }
            return finalStatus;
        } finally {
            active.decrementAndGet();
            slots.release();
            Timer.builder("celia.jobs.duration")
                    .tag("status", finalStatus.value())
                    .register(meterRegistry)
                    .record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        }
    }

    /** Jobs currently holding a slot. */
    public int activeJobs() {
        return active.get();
    }

    /** Highest number of jobs that ever held a slot at the same time. */
    public int peakActiveJobs() {
        return peak.get();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job coordinator ({} active)", active.get());
        dispatchPool.shutdownNow();
        pipelinePool.shutdownNow();
    }

    private void awaitStop(String jobId, CountDownLatch stopped) throws InterruptedException {
        if (!stopped.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Job {} pipeline still running {} after cancellation; releasing its slot", jobId, cancelGrace);
        }
    }

    private JobStatus fail(String jobId, String message) {
        MDC.put("jobId", jobId);
        try {
            if (!store.setError(jobId, message)) {
                return store.get(jobId).map(JobSnapshot::status).orElse(JobStatus.FAILED);
            }
            return JobStatus.FAILED;
        } finally {
            MDC.remove("jobId");
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
