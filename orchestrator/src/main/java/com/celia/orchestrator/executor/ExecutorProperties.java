package com.celia.orchestrator.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Command-execution backend settings, bound from {@code celia.executor.*}.
 */
@Component
@ConfigurationProperties(prefix = "celia.executor")
public class ExecutorProperties {

    /** "simulated" or "remote". */
    private String   mode            = "simulated";
    private String   baseUrl         = "http://localhost:8000";
    private String   gitRef          = "main";
    private Duration commandTimeout  = Duration.ofMinutes(5);
    private Duration cloneDelay      = Duration.ofMillis(1500);
    private Duration commandDelay    = Duration.ofMillis(500);

    public String getMode()                     { return mode; }
    public void setMode(String v)               { this.mode = v; }
    public String getBaseUrl()                  { return baseUrl; }
    public void setBaseUrl(String v)            { this.baseUrl = v; }
    public String getGitRef()                   { return gitRef; }
    public void setGitRef(String v)             { this.gitRef = v; }
    public Duration getCommandTimeout()         { return commandTimeout; }
    public void setCommandTimeout(Duration v)   { this.commandTimeout = v; }
    public Duration getCloneDelay()             { return cloneDelay; }
    public void setCloneDelay(Duration v)       { this.cloneDelay = v; }
    public Duration getCommandDelay()           { return commandDelay; }
    public void setCommandDelay(Duration v)     { this.commandDelay = v; }
}
