package com.celia.orchestrator.executor;

import com.celia.orchestrator.resilience.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Stand-in backend: nothing is cloned or executed, only the latency is reproduced.
 * Every command succeeds.
 */
@Component
@ConditionalOnProperty(name = "celia.executor.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCommandExecutor.class);

    private final Duration cloneDelay;
    private final Duration commandDelay;
    private final Sleeper  sleeper;

    @Autowired
    public SimulatedCommandExecutor(ExecutorProperties properties) {
        this(properties.getCloneDelay(), properties.getCommandDelay(), Sleeper.SYSTEM);
    }

    public SimulatedCommandExecutor(Duration cloneDelay, Duration commandDelay, Sleeper sleeper) {
        this.cloneDelay   = cloneDelay;
        this.commandDelay = commandDelay;
        this.sleeper      = sleeper;
    }

    @Override
    public void syncWorkspace(String jobId, String repoUrl) throws InterruptedException {
        log.debug("Simulating workspace sync for job {} from {}", jobId, repoUrl);
        sleeper.sleep(cloneDelay);
    }

    @Override
    public CommandResult run(String jobId, String command) throws InterruptedException {
        log.debug("Simulating command for job {}: {}", jobId, command);
        sleeper.sleep(commandDelay);
        return CommandResult.ok("(simulated)", commandDelay.toMillis() / 1000.0);
    }
}
