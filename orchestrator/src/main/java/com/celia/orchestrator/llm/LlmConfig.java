package com.celia.orchestrator.llm;

import com.celia.orchestrator.resilience.ErrorClassifier;
import com.celia.orchestrator.resilience.RateLimiter;
import com.celia.orchestrator.resilience.RetryConfig;
import com.celia.orchestrator.resilience.RetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the resilient call path: one rate limiter shared by every job,
 * a retry executor in front of it, and the optional response cache.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    RateLimiter rateLimiter(LlmProperties props) {
        return new RateLimiter(props.getRequestsPerMinute());
    }

    @Bean
    RetryExecutor retryExecutor(LlmProperties props, RateLimiter rateLimiter) {
        LlmProperties.Retry r = props.getRetry();
        RetryConfig config = new RetryConfig(
                r.getMaxAttempts(), r.getBaseDelay(), r.getMaxDelay(), r.getExponentialBase());
        return new RetryExecutor(config, rateLimiter, new ErrorClassifier());
    }

    @Bean
    ResilientCallClient resilientCallClient(TextGenerator generator,
                                            RetryExecutor retryExecutor,
                                            LlmProperties props,
                                            Clock clock,
                                            MeterRegistry meterRegistry) {
        ResponseCache cache = null;
        if (props.getCache().isEnabled()) {
            cache = new ResponseCache(props.getCache().getMaxEntries(), props.getCache().getTtl(), clock);
        }
        log.info("LLM client: model={}, {} requests/min, {} attempts, cache {}",
                props.getModel(), props.getRequestsPerMinute(), props.getRetry().getMaxAttempts(),
                cache != null ? "enabled (" + props.getCache().getMaxEntries() + " entries)" : "disabled");
        return new ResilientCallClient(generator, retryExecutor, cache, props.getMaxMessageLength(), meterRegistry);
    }
}
