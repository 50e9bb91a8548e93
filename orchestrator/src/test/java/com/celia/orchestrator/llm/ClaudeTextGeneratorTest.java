package com.celia.orchestrator.llm;

import com.celia.orchestrator.resilience.ErrorClassifier;
import com.celia.orchestrator.resilience.ServiceCallException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Status mapping and configuration checks; no network calls are made.
 */
class ClaudeTextGeneratorTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void errorFor_authenticationAndModelErrors_areFatal() {
        assertThat(ClaudeTextGenerator.errorFor(401, "{}").isFatal()).isTrue();
        assertThat(ClaudeTextGenerator.errorFor(403, "{}").isFatal()).isTrue();
        assertThat(ClaudeTextGenerator.errorFor(404, "{}").isFatal()).isTrue();
        assertThat(classifier.isRetryable(ClaudeTextGenerator.errorFor(401, "{}"))).isFalse();
    }

    @Test
    void errorFor_throttlingAndServerErrors_areTransient() {
        for (int status : new int[] {408, 429, 500, 503, 529}) {
            ServiceCallException e = ClaudeTextGenerator.errorFor(status, "{\"error\":\"busy\"}");
            assertThat(e.isFatal()).as("status %d", status).isFalse();
            assertThat(e.getStatusCode()).isEqualTo(status);
            assertThat(classifier.isRetryable(e)).as("status %d", status).isTrue();
        }
    }

    @Test
    void errorFor_otherClientErrors_areFatal() {
        assertThat(ClaudeTextGenerator.errorFor(400, "bad request").isFatal()).isTrue();
    }

    @Test
    void generate_withoutApiKey_failsFatallyWithoutCalling() {
        ClaudeTextGenerator generator = new ClaudeTextGenerator("", new LlmProperties(), new ObjectMapper());

        assertThatThrownBy(() -> generator.generate(GenerationRequest.of("hi", null, false)))
                .isInstanceOf(ServiceCallException.class)
                .hasMessageContaining("Authentication failed")
                .matches(e -> ((ServiceCallException) e).isFatal());
    }
}
