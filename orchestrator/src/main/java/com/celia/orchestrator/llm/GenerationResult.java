package com.celia.orchestrator.llm;

/**
 * Model answer plus the token usage reported by the provider.
 */
public record GenerationResult(String text, long inputTokens, long outputTokens) {

    public GenerationResult {
        text = text == null ? "" : text;
    }

    public static GenerationResult ofText(String text) {
        return new GenerationResult(text, 0, 0);
    }
}
