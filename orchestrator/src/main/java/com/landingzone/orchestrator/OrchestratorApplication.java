package com.landingzone.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(OrchestratorApplication.class, args);

        // One-shot mode: RunOnceRunner has already run the pipeline; exit with its result.
        if (ctx.getEnvironment().getProperty("landing.run-once", Boolean.class, false)) {
            System.exit(SpringApplication.exit(ctx));
        }
    }
}
