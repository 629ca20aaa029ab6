package com.landingzone.orchestrator.service;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot mode for external schedulers: run the pipeline once at startup
 * and report the outcome as the process exit code (0 = SUCCEEDED).
 *
 * To run:
 *   java -jar orchestrator.jar --landing.run-once=true --spring.main.web-application-type=none
 */
@Component
@ConditionalOnProperty(name = "landing.run-once", havingValue = "true")
public class RunOnceRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RunOnceRunner.class);

    private final PipelineTrigger trigger;

    private int exitCode = 1;

    public RunOnceRunner(PipelineTrigger trigger) {
        this.trigger = trigger;
    }

    @Override
    public void run(String... args) {
        PipelineRun run = trigger.runNow();
        exitCode = run.getStatus() == RunStatus.SUCCEEDED ? 0 : 1;
        log.info("One-shot run {} finished {}", run.getId(), run.getStatus());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
