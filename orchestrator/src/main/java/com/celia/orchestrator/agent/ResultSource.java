package com.celia.orchestrator.agent;

/**
 * Where a planning or summarization result came from.
 */
public enum ResultSource {
    /** The model answered and the answer was usable. */
    GENERATED,
    /** The model answered with nothing. */
    EMPTY,
    /** The call or its parsing failed; deterministic substitute content was used. */
    FALLBACK
}
