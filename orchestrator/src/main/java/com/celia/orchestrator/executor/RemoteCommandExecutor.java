package com.celia.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for an external sandbox executor service.
 *
 * The job id doubles as the workspace reference. Sandboxing is entirely the
 * executor service's job; this class only moves JSON.
 *
 *   POST /workspace/create       {workspace_ref, repo_url, git_ref}
 *   POST /workspace/run_command  {workspace_ref, command, timeout_sec} → CommandResult
 */
@Component
@ConditionalOnProperty(name = "celia.executor.mode", havingValue = "remote")
public class RemoteCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandExecutor.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       gitRef;
    private final Duration     commandTimeout;

    public RemoteCommandExecutor(ExecutorProperties properties, ObjectMapper objectMapper) {
        this.baseUrl        = properties.getBaseUrl();
        this.gitRef         = properties.getGitRef();
        this.commandTimeout = properties.getCommandTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void syncWorkspace(String jobId, String repoUrl) throws InterruptedException {
        log.info("Creating workspace '{}' from {} @ {}", jobId, repoUrl, gitRef);
        String body = toJson(Map.of("workspace_ref", jobId,
                                    "repo_url",      repoUrl,
                                    "git_ref",       gitRef));
        post("/workspace/create", body, "syncWorkspace for " + jobId, Duration.ofSeconds(120));
    }

    @Override
    public CommandResult run(String jobId, String command) throws InterruptedException {
        String body = toJson(Map.of("workspace_ref", jobId,
                                    "command",       command,
                                    "timeout_sec",   commandTimeout.toSeconds()));
        // Allow a bit more wall-clock time than the sandbox timeout.
        String respBody = post("/workspace/run_command", body, "run for workspace " + jobId,
                commandTimeout.plusSeconds(30));
        try {
            return json.readValue(respBody, CommandResult.class);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse run_command response", e);
        }
    }

    /** POST with an explicit timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName, Duration timeout) throws InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExecutorException(opName + " failed", e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ExecutorException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return resp.body();
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
