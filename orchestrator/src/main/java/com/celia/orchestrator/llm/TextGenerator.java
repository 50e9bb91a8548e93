package com.celia.orchestrator.llm;

/**
 * The external text-generation capability.
 *
 * Implementations make exactly one provider call per invocation (no retries,
 * no throttling; {@link ResilientCallClient} adds both) and report failures as
 * {@link com.celia.orchestrator.resilience.ServiceCallException} with a
 * TRANSIENT or FATAL kind.
 */
public interface TextGenerator {

    GenerationResult generate(GenerationRequest request) throws InterruptedException;
}
