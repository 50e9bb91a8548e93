package com.celia.orchestrator.executor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one command.
 * Field names match the executor service's JSON response.
 *
 * @param errorType "TIMEOUT" | "POLICY_VIOLATION" | null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResult(
        @JsonProperty("exit_code")   int    exitCode,
        @JsonProperty("stdout")      String stdout,
        @JsonProperty("stderr")      String stderr,
        @JsonProperty("elapsed_sec") double elapsedSec,
        @JsonProperty("error_type")  String errorType
) {
    public static CommandResult ok(String stdout, double elapsedSec) {
        return new CommandResult(0, stdout, "", elapsedSec, null);
    }

    public boolean success() {
        return exitCode == 0 && errorType == null;
    }

    /** One-line description for the job log. */
    public String describe() {
        StringBuilder sb = new StringBuilder("exit_code=").append(exitCode);
        if (errorType != null) {
            sb.append(" error_type=").append(errorType);
        }
        if (stderr != null && !stderr.isBlank()) {
            String firstLine = stderr.strip().lines().findFirst().orElse("");
            sb.append(" stderr: ").append(firstLine);
        }
        return sb.toString();
    }
}
