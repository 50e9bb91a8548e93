package com.celia.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs a fallible call with exponential backoff.
 *
 * Every attempt, the first one included, passes through the shared
 * {@link RateLimiter} before it is issued. Non-retryable errors abort at once;
 * transient ones are retried until {@link RetryConfig#maxAttempts()} is reached.
 * Either way the caller receives one {@link CallFailedException}.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig     config;
    private final RateLimiter     rateLimiter;
    private final ErrorClassifier classifier;
    private final Sleeper         sleeper;

    public RetryExecutor(RetryConfig config, RateLimiter rateLimiter, ErrorClassifier classifier) {
        this(config, rateLimiter, classifier, Sleeper.SYSTEM);
    }

    public RetryExecutor(RetryConfig config, RateLimiter rateLimiter,
                         ErrorClassifier classifier, Sleeper sleeper) {
        this.config      = config;
        this.rateLimiter = rateLimiter;
        this.classifier  = classifier;
        this.sleeper     = sleeper;
    }

    /**
     * @param operation name used in logs and in the failure message
     * @throws CallFailedException  when the call did not succeed
     * @throws InterruptedException when interrupted while throttled or backing off
     */
    public <T> T execute(String operation, Callable<T> call) throws InterruptedException {
        Exception lastError = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            rateLimiter.acquire();
            try {
                T result = call.call();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", operation, attempt, config.maxAttempts());
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastError = e;
                ErrorClassifier.Category category = classifier.classify(e);
                if (category != ErrorClassifier.Category.TRANSIENT) {
                    log.error("{} failed with non-retryable error [{}] on attempt {}: {}",
                            operation, category, attempt, e.getMessage());
                    throw new CallFailedException(operation, attempt, category, e);
                }
                if (attempt == config.maxAttempts()) {
                    break;
                }
                Duration delay = config.delayAfter(attempt);
                log.warn("{} attempt {}/{} failed: {}. Retrying in {} ms",
                        operation, attempt, config.maxAttempts(), e.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
        log.error("{} exhausted {} attempts: {}", operation, config.maxAttempts(), lastError.getMessage());
        throw new CallFailedException(operation, config.maxAttempts(),
                ErrorClassifier.Category.TRANSIENT, lastError);
    }

    public RetryConfig config() {
        return config;
    }
}
