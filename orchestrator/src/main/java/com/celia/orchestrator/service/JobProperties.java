package com.celia.orchestrator.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Job execution settings, bound from {@code celia.jobs.*}.
 */
@Component
@ConfigurationProperties(prefix = "celia.jobs")
public class JobProperties {

    /** Size of the coordinator's slot pool; fixed once the coordinator is built. */
    private int      maxConcurrent     = 3;
    /** Wall-clock budget for one job's whole pipeline. */
    private Duration timeout           = Duration.ofMinutes(10);
    /** How long a timed-out job keeps its slot while its pipeline thread winds down. */
    private Duration cancelGrace       = Duration.ofSeconds(5);
    private String   workspaceDir      = "jobs";
    private int      maxTaskLength     = 5000;
    private int      maxPlanSteps      = 20;
    private int      maxCommandLogLength = 200;
    private int      summaryLogTail    = 1000;
    /** Simulated per-step reasoning latency. */
    private Duration stepDelay         = Duration.ofSeconds(1);
    private int      retentionDays     = 30;

    public int getMaxConcurrent()               { return maxConcurrent; }
    public void setMaxConcurrent(int v)         { this.maxConcurrent = v; }
    public Duration getTimeout()                { return timeout; }
    public void setTimeout(Duration v)          { this.timeout = v; }
    public Duration getCancelGrace()            { return cancelGrace; }
    public void setCancelGrace(Duration v)      { this.cancelGrace = v; }
    public String getWorkspaceDir()             { return workspaceDir; }
    public void setWorkspaceDir(String v)       { this.workspaceDir = v; }
    public int getMaxTaskLength()               { return maxTaskLength; }
    public void setMaxTaskLength(int v)         { this.maxTaskLength = v; }
    public int getMaxPlanSteps()                { return maxPlanSteps; }
    public void setMaxPlanSteps(int v)          { this.maxPlanSteps = v; }
    public int getMaxCommandLogLength()         { return maxCommandLogLength; }
    public void setMaxCommandLogLength(int v)   { this.maxCommandLogLength = v; }
    public int getSummaryLogTail()              { return summaryLogTail; }
    public void setSummaryLogTail(int v)        { this.summaryLogTail = v; }
    public Duration getStepDelay()              { return stepDelay; }
    public void setStepDelay(Duration v)        { this.stepDelay = v; }
    public int getRetentionDays()               { return retentionDays; }
    public void setRetentionDays(int v)         { this.retentionDays = v; }
}
