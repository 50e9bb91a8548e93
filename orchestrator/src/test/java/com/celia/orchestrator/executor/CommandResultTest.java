package com.celia.orchestrator.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandResultTest {

    @Test
    void readsExecutorServiceResponse() throws Exception {
        CommandResult result = new ObjectMapper().readValue("""
                {"exit_code": 2, "stdout": "", "stderr": "make: *** No rule\\nmore", "elapsed_sec": 0.4,
                 "error_type": null, "workspace_ref": "job-1"}
                """, CommandResult.class);

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.success()).isFalse();
        assertThat(result.describe()).isEqualTo("exit_code=2 stderr: make: *** No rule");
    }

    @Test
    void timeoutIsNotSuccessEvenWithZeroExit() {
        CommandResult result = new CommandResult(0, "", "", 300.0, "TIMEOUT");

        assertThat(result.success()).isFalse();
        assertThat(result.describe()).isEqualTo("exit_code=0 error_type=TIMEOUT");
    }
}
