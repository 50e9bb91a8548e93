package com.celia.orchestrator.llm;

/**
 * One text-generation call.
 *
 * @param systemInstruction optional, may be null
 * @param jsonMode          ask the model to answer with JSON only
 * @param temperature       sampling temperature in [0, 1]
 * @param maxOutputTokens   optional cap on the answer length, null for the provider default
 */
public record GenerationRequest(
        String  message,
        String  systemInstruction,
        boolean jsonMode,
        double  temperature,
        Integer maxOutputTokens
) {
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public static GenerationRequest of(String message, String systemInstruction, boolean jsonMode) {
        return new GenerationRequest(message, systemInstruction, jsonMode, DEFAULT_TEMPERATURE, null);
    }

    public GenerationRequest withTemperature(double value) {
        return new GenerationRequest(message, systemInstruction, jsonMode, value, maxOutputTokens);
    }

    public GenerationRequest withMaxOutputTokens(Integer value) {
        return new GenerationRequest(message, systemInstruction, jsonMode, temperature, value);
    }
}
