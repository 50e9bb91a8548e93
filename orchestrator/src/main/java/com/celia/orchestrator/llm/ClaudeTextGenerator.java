package com.celia.orchestrator.llm;

import com.celia.orchestrator.resilience.ServiceCallException;
import com.celia.orchestrator.resilience.ServiceCallException.Kind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TextGenerator backed by the Anthropic Messages API.
 *
 * Single-turn only: one user message plus an optional system instruction.
 * HTTP status codes are mapped onto the TRANSIENT / FATAL split the retry
 * layer understands; retrying itself is not done here.
 */
@Component
public class ClaudeTextGenerator implements TextGenerator {

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content, Usage usage, @JsonProperty("stop_reason") String stopReason) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Usage(@JsonProperty("input_tokens") long inputTokens,
                     @JsonProperty("output_tokens") long outputTokens) {}

        String joinedText() {
            if (content == null) return "";
            StringBuilder sb = new StringBuilder();
            content.stream()
                    .filter(b -> "text".equals(b.type()) && b.text() != null)
                    .forEach(b -> sb.append(b.text()));
            return sb.toString();
        }
    }

    private static final String API_VER            = "2023-06-01";
    private static final String JSON_ONLY_SUFFIX   =
            "\n\nRespond ONLY with valid JSON. No prose, no markdown fences.";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final LlmProperties properties;

    public ClaudeTextGenerator(@Value("${anthropic.api-key:}") String apiKey,
                               LlmProperties properties,
                               ObjectMapper objectMapper) {
        this.apiKey     = apiKey;
        this.properties = properties;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) throws InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ServiceCallException(Kind.FATAL, "Authentication failed: no API key configured");
        }
        String requestBody = toJson(buildBody(request));

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/v1/messages"))
                .timeout(properties.getRequestTimeout())
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ServiceCallException(Kind.TRANSIENT, "Claude API unreachable: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw errorFor(response.statusCode(), response.body());
        }

        try {
            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            if ("refusal".equals(parsed.stopReason())) {
                throw new ServiceCallException(Kind.FATAL, "Request blocked by content policy (refusal)");
            }
            long in  = parsed.usage() == null ? 0 : parsed.usage().inputTokens();
            long out = parsed.usage() == null ? 0 : parsed.usage().outputTokens();
            return new GenerationResult(parsed.joinedText(), in, out);
        } catch (IOException e) {
            throw new ServiceCallException(Kind.TRANSIENT, "Malformed Claude API response: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> buildBody(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("max_tokens", request.maxOutputTokens() != null
                ? request.maxOutputTokens()
                : properties.getMaxOutputTokens());
        body.put("temperature", request.temperature());

        String system = request.systemInstruction() == null ? "" : request.systemInstruction();
        if (request.jsonMode()) {
            system = system + JSON_ONLY_SUFFIX;
        }
        if (!system.isBlank()) {
            body.put("system", system.strip());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.message())));
        return body;
    }

    /**
     * 401/403 → authentication, 404 → unknown model, 400 mentioning policy → content policy:
     * all FATAL. Throttling, timeouts, overload and server errors are TRANSIENT.
     */
    static ServiceCallException errorFor(int status, String body) {
        String detail = "Claude API error %d: %s".formatted(status, body);
        return switch (status) {
            case 401 -> new ServiceCallException(Kind.FATAL, status, "Authentication failed (invalid api key). " + detail, null);
            case 403 -> new ServiceCallException(Kind.FATAL, status, "Permission denied. " + detail, null);
            case 404 -> new ServiceCallException(Kind.FATAL, status, "Invalid model or endpoint. " + detail, null);
            case 408, 409, 429, 500, 502, 503, 504, 529 ->
                    new ServiceCallException(Kind.TRANSIENT, status, detail, null);
            default -> new ServiceCallException(
                    status >= 500 ? Kind.TRANSIENT : Kind.FATAL, status, detail, null);
        };
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (IOException e) {
            throw new ServiceCallException(Kind.FATAL, "Could not serialize request: " + e.getMessage(), e);
        }
    }
}
