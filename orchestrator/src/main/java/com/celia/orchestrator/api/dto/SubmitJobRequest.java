package com.celia.orchestrator.api.dto;

/**
 * Request body for POST /jobs.
 *
 * Required: task
 * Optional: repoUrl; when present the workspace is synchronized from it before
 *   planning, and it is passed to the planner as context.
 */
public record SubmitJobRequest(String task, String repoUrl) {}
