package com.celia.orchestrator.executor;

/**
 * Where plan commands run.
 *
 * The pipeline only talks to this interface, so swapping the simulated
 * backend for the remote sandbox does not change pipeline logic.
 * Selected by {@code celia.executor.mode} ({@code simulated} or {@code remote}).
 */
public interface CommandExecutor {

    /**
     * Make the repository available in the job's workspace (clone or refresh).
     *
     * @throws ExecutorException if the workspace cannot be prepared
     */
    void syncWorkspace(String jobId, String repoUrl) throws InterruptedException;

    /**
     * Run one shell command in the job's workspace.
     * A non-zero exit code is reported in the result, not thrown.
     *
     * @throws ExecutorException if the backend itself fails
     */
    CommandResult run(String jobId, String command) throws InterruptedException;
}
