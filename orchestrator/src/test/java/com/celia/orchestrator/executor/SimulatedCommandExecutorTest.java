package com.celia.orchestrator.executor;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedCommandExecutorTest {

    final List<Duration> sleeps = new ArrayList<>();

    final SimulatedCommandExecutor executor = new SimulatedCommandExecutor(
            Duration.ofMillis(1500), Duration.ofMillis(500), sleeps::add);

    @Test
    void syncWorkspace_waitsCloneDelay() throws Exception {
        executor.syncWorkspace("job-1", "https://github.com/org/repo.git");

        assertThat(sleeps).containsExactly(Duration.ofMillis(1500));
    }

    @Test
    void run_waitsCommandDelayAndSucceeds() throws Exception {
        CommandResult result = executor.run("job-1", "make test");

        assertThat(result.success()).isTrue();
        assertThat(result.exitCode()).isZero();
        assertThat(sleeps).containsExactly(Duration.ofMillis(500));
    }
}
