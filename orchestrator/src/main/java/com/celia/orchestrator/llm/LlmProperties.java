package com.celia.orchestrator.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the outbound text-generation client, bound from {@code celia.llm.*}.
 */
@Component
@ConfigurationProperties(prefix = "celia.llm")
public class LlmProperties {

    private String   baseUrl            = "https://api.anthropic.com";
    private String   model              = "claude-sonnet-4-6";
    private int      maxOutputTokens    = 4096;
    private int      maxMessageLength   = 100_000;
    private double   temperature        = 0.7;
    private Duration connectTimeout     = Duration.ofSeconds(10);
    private Duration requestTimeout     = Duration.ofSeconds(60);
    private int      requestsPerMinute  = 60;

    private final Retry retry = new Retry();
    private final Cache cache = new Cache();

    public String getBaseUrl()                  { return baseUrl; }
    public void setBaseUrl(String v)            { this.baseUrl = v; }
    public String getModel()                    { return model; }
    public void setModel(String v)              { this.model = v; }
    public int getMaxOutputTokens()             { return maxOutputTokens; }
    public void setMaxOutputTokens(int v)       { this.maxOutputTokens = v; }
    public int getMaxMessageLength()            { return maxMessageLength; }
    public void setMaxMessageLength(int v)      { this.maxMessageLength = v; }
    public double getTemperature()              { return temperature; }
    public void setTemperature(double v)        { this.temperature = v; }
    public Duration getConnectTimeout()         { return connectTimeout; }
    public void setConnectTimeout(Duration v)   { this.connectTimeout = v; }
    public Duration getRequestTimeout()         { return requestTimeout; }
    public void setRequestTimeout(Duration v)   { this.requestTimeout = v; }
    public int getRequestsPerMinute()           { return requestsPerMinute; }
    public void setRequestsPerMinute(int v)     { this.requestsPerMinute = v; }
    public Retry getRetry()                     { return retry; }
    public Cache getCache()                     { return cache; }

    public static class Retry {
        private int      maxAttempts     = 3;
        private Duration baseDelay       = Duration.ofSeconds(1);
        private Duration maxDelay        = Duration.ofSeconds(10);
        private double   exponentialBase = 2.0;

        public int getMaxAttempts()                 { return maxAttempts; }
        public void setMaxAttempts(int v)           { this.maxAttempts = v; }
        public Duration getBaseDelay()              { return baseDelay; }
        public void setBaseDelay(Duration v)        { this.baseDelay = v; }
        public Duration getMaxDelay()               { return maxDelay; }
        public void setMaxDelay(Duration v)         { this.maxDelay = v; }
        public double getExponentialBase()          { return exponentialBase; }
        public void setExponentialBase(double v)    { this.exponentialBase = v; }
    }

    public static class Cache {
        private boolean  enabled    = true;
        private int      maxEntries = 256;
        private Duration ttl        = Duration.ofHours(1);

        public boolean isEnabled()              { return enabled; }
        public void setEnabled(boolean v)       { this.enabled = v; }
        public int getMaxEntries()              { return maxEntries; }
        public void setMaxEntries(int v)        { this.maxEntries = v; }
        public Duration getTtl()                { return ttl; }
        public void setTtl(Duration v)          { this.ttl = v; }
    }
}
