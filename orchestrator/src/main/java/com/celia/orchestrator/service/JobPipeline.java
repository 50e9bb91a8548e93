package com.celia.orchestrator.service;

import com.celia.orchestrator.agent.PlanGenerator;
import com.celia.orchestrator.agent.PlanResult;
import com.celia.orchestrator.agent.ResultSummarizer;
import com.celia.orchestrator.agent.SummaryResult;
import com.celia.orchestrator.executor.CommandExecutor;
import com.celia.orchestrator.executor.CommandResult;
import com.celia.orchestrator.model.JobSnapshot;
import com.celia.orchestrator.model.JobStatus;
import com.celia.orchestrator.model.PlanStep;
import com.celia.orchestrator.resilience.Sleeper;
import com.celia.orchestrator.store.JobNotFoundException;
import com.celia.orchestrator.store.JobStore;
import com.celia.orchestrator.store.LogLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Drives one job from RUNNING to COMPLETED.
 *
 * Stages run strictly in order on the calling thread:
 * <ol>
 *   <li>mark running</li>
 *   <li>sync the workspace (only when the job names a repository)</li>
 *   <li>plan</li>
 *   <li>execute every step's commands in plan order</li>
 *   <li>summarize and write the report</li>
 *   <li>mark completed</li>
 * </ol>
 * Errors are not handled here: they propagate to {@link JobExecutionCoordinator},
 * which records the failure. Progress goes to the job log as it happens, so a
 * failed job keeps everything logged up to the failure.
 */
@Component
public class JobPipeline {

    private static final Logger log = LoggerFactory.getLogger(JobPipeline.class);

    private final JobStore         store;
    private final PlanGenerator    planner;
    private final ResultSummarizer summarizer;
    private final CommandExecutor  executor;
    private final ArtifactStore    artifacts;
    private final Sleeper          sleeper;
    private final Duration         stepDelay;
    private final int              maxCommandLogLength;
    private final int              reportLogTail;

    @Autowired
    public JobPipeline(JobStore store,
                       PlanGenerator planner,
                       ResultSummarizer summarizer,
                       CommandExecutor executor,
                       ArtifactStore artifacts,
                       JobProperties properties) {
        this(store, planner, summarizer, executor, artifacts, properties, Sleeper.SYSTEM);
    }

    public JobPipeline(JobStore store,
                       PlanGenerator planner,
                       ResultSummarizer summarizer,
                       CommandExecutor executor,
                       ArtifactStore artifacts,
                       JobProperties properties,
                       Sleeper sleeper) {
        this.store               = store;
        this.planner             = planner;
        this.summarizer          = summarizer;
        this.executor            = executor;
        this.artifacts           = artifacts;
        this.sleeper             = sleeper;
        this.stepDelay           = properties.getStepDelay();
        this.maxCommandLogLength = properties.getMaxCommandLogLength();
        this.reportLogTail       = properties.getSummaryLogTail();
    }

    /**
     * Run the whole pipeline for {@code jobId}.
     *
     * @return the job's status when the pipeline returns: COMPLETED normally, or
     *         whatever terminal status the job already had if it was finished elsewhere
     * @throws InterruptedException if the job was cancelled (timeout or shutdown)
     */
    public JobStatus run(String jobId) throws InterruptedException {
        MDC.put("jobId", jobId);
        try {
            // 1. Start
            if (!store.updateStatus(jobId, JobStatus.RUNNING)) {
                JobStatus current = currentStatus(jobId);
                log.warn("Job is {} and cannot start, skipping", current);
                return current;
            }
            store.appendLog(jobId, "[SYSTEM] Celia engine initialized. Job " + jobId + " accepted for execution.");
            JobSnapshot job = load(jobId);
            log.info("Pipeline started: task='{}' repo={}", abbreviate(job.task(), 80), job.repoUrl());

            // 2. Workspace
            if (job.hasRepository()) {
                store.appendLog(jobId, "[GIT] Synchronizing workspace with: " + job.repoUrl());
                executor.syncWorkspace(jobId, job.repoUrl());
                store.appendLog(jobId, "[GIT] Repository cloned. Workspace verified.");
            }

            // 3. Plan
            store.appendLog(jobId, "[BRAIN] Requesting an execution plan...");
            PlanResult plan = planner.createPlan(job.task(), job.repoUrl());
            if (plan.isFallback()) {
                store.appendLog(jobId, "[BRAIN] Planning unavailable (" + plan.failureReason()
                        + "). Continuing with the fallback plan.");
            } else {
                store.appendLog(jobId, "[BRAIN] Plan ready: " + plan.plan().size() + " step(s).");
            }

            // 4. Steps
            for (PlanStep step : plan.plan().steps()) {
                runStep(jobId, step);
            }

            // 5. Report
            store.appendLog(jobId, "[REPORT] Compiling final report...");
            JobSnapshot beforeReport = load(jobId);
            SummaryResult summary = summarizer.summarize(beforeReport.logs(), beforeReport.files());
            switch (summary.source()) {
                case EMPTY    -> store.appendLog(jobId, "[REPORT] Summarizer returned no content.");
                case FALLBACK -> store.appendLog(jobId, "[REPORT] Summarizer unavailable ("
                        + summary.failureReason() + "). Offline summary used.");
                case GENERATED -> { }
            }
            String reportName = artifacts.writeReport(beforeReport, summary,
                    LogLines.tail(beforeReport.logs(), reportLogTail));
            store.addFile(jobId, reportName);

            // 6. Done
            store.appendLog(jobId, "[SUCCESS] All objectives verified. Artifacts ready.");
            if (!store.updateStatus(jobId, JobStatus.COMPLETED)) {
                return currentStatus(jobId);
            }
            log.info("Pipeline completed");
            return JobStatus.COMPLETED;
        } finally {
            MDC.remove("jobId");
        }
    }

    private void runStep(String jobId, PlanStep step) throws InterruptedException {
        store.appendLog(jobId, "[STEP " + step.stepNumber() + "] " + step.action());
        store.appendLog(jobId, "Expected outcome: " + step.expectedOutcome());

        for (String command : step.commands()) {
            store.appendLog(jobId, "[CMD] $ " + abbreviate(command, maxCommandLogLength));
            CommandResult result = executor.run(jobId, command);
            if (!result.success()) {
                // Not fatal: the plan keeps going.
                log.warn("Command failed in step {}: {}", step.stepNumber(), result.describe());
                store.appendLog(jobId, "[CMD] failed: " + result.describe());
            }
        }
        sleeper.sleep(stepDelay);
    }

    private JobSnapshot load(String jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobStatus currentStatus(String jobId) {
        return load(jobId).status();
    }

    static String abbreviate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max) + "...";
    }
}
