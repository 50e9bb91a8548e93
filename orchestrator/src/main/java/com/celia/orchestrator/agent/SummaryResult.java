package com.celia.orchestrator.agent;

/**
 * @param failureReason why the offline summary was substituted; null otherwise
 */
public record SummaryResult(String text, ResultSource source, String failureReason) {

    public static SummaryResult generated(String text) {
        return new SummaryResult(text, ResultSource.GENERATED, null);
    }

    public static SummaryResult empty() {
        return new SummaryResult("", ResultSource.EMPTY, null);
    }

    public static SummaryResult fallback(String text, String reason) {
        return new SummaryResult(text, ResultSource.FALLBACK, reason);
    }
}
