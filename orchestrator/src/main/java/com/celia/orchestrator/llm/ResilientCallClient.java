package com.celia.orchestrator.llm;

import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.resilience.CallFailedException;
import com.celia.orchestrator.resilience.RetryExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The only path from the job pipeline to the text generator.
 *
 * Per call: validate the request, answer from the cache when possible,
 * otherwise issue the call through the {@link RetryExecutor} (which applies the
 * shared rate limiter before every attempt) and record usage.
 *
 * Counters (Micrometer, monotonic):
 * <pre>
 *   celia.llm.requests{outcome="success|failure"}
 *   celia.llm.tokens{type="input|output"}
 *   celia.llm.cache.hits
 * </pre>
 */
public class ResilientCallClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientCallClient.class);

    private final TextGenerator generator;
    private final RetryExecutor retryExecutor;
    private final ResponseCache cache;             // null when caching is disabled
    private final int           maxMessageLength;

    private final Counter successes;
    private final Counter failures;
    private final Counter inputTokens;
    private final Counter outputTokens;
    private final Counter cacheHits;

    public ResilientCallClient(TextGenerator generator,
                               RetryExecutor retryExecutor,
                               ResponseCache cache,
                               int maxMessageLength,
                               MeterRegistry meterRegistry) {
        this.generator        = generator;
        this.retryExecutor    = retryExecutor;
        this.cache            = cache;
        this.maxMessageLength = maxMessageLength;

        this.successes    = meterRegistry.counter("celia.llm.requests", "outcome", "success");
        this.failures     = meterRegistry.counter("celia.llm.requests", "outcome", "failure");
        this.inputTokens  = meterRegistry.counter("celia.llm.tokens", "type", "input");
        this.outputTokens = meterRegistry.counter("celia.llm.tokens", "type", "output");
        this.cacheHits    = meterRegistry.counter("celia.llm.cache.hits");
    }

    /**
     * Generate text for {@code request}.
     *
     * @throws ValidationException  if the request is malformed (no call is made)
     * @throws CallFailedException  if the call failed after retries or was rejected as fatal
     * @throws InterruptedException if the calling job was cancelled
     */
    public String generate(GenerationRequest request) throws InterruptedException {
        validate(request);

        String key = cache != null ? ResponseCache.keyFor(request) : null;
        if (cache != null) {
            Optional<String> cached = cache.get(key);
            if (cached.isPresent()) {
                cacheHits.increment();
                log.debug("Response cache hit ({} chars)", cached.get().length());
                return cached.get();
            }
        }

        GenerationResult result;
        try {
            result = retryExecutor.execute("text generation", () -> generator.generate(request));
        } catch (CallFailedException e) {
            failures.increment();
            throw e;
        }

        successes.increment();
        inputTokens.increment(result.inputTokens());
        outputTokens.increment(result.outputTokens());

        if (cache != null) {
            cache.put(key, result.text());
        }
        return result.text();
    }

    public UsageStats usage() {
        return new UsageStats(
                (long) (successes.count() + failures.count()),
                (long) failures.count(),
                (long) inputTokens.count(),
                (long) outputTokens.count(),
                (long) cacheHits.count());
    }

    private void validate(GenerationRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new ValidationException("Message must not be empty");
        }
        if (request.message().length() > maxMessageLength) {
            throw new ValidationException("Message is %d characters (limit: %d)"
                    .formatted(request.message().length(), maxMessageLength));
        }
        if (Double.isNaN(request.temperature()) || request.temperature() < 0.0 || request.temperature() > 1.0) {
            throw new ValidationException("Temperature must be within [0, 1], got " + request.temperature());
        }
        if (request.maxOutputTokens() != null && request.maxOutputTokens() <= 0) {
            throw new ValidationException("maxOutputTokens must be positive, got " + request.maxOutputTokens());
        }
    }
}
