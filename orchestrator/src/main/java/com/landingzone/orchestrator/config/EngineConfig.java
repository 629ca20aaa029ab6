package com.landingzone.orchestrator.config;

import com.landingzone.orchestrator.engine.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources shared by the poller, the job client and the executor.
 * Tests construct those classes directly with a fake clock instead.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
