package com.celia.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    /**
     * Single time source for timestamps, log lines, cache expiry and retention.
     * Tests substitute a fixed clock.
     */
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
