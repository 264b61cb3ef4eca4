package com.studioflow.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    /** Single time source so rate-limit days, leases and timeouts can be pinned in tests. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
