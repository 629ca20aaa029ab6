package com.landingzone.orchestrator.service;

import com.landingzone.orchestrator.engine.StepChainExecutor;
import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.pipeline.PipelineDefinition;
import com.landingzone.orchestrator.pipeline.PipelineDefinitionFactory;
import com.landingzone.orchestrator.pipeline.Step;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point for whatever schedules the pipeline (cron, Airflow, Cloud
 * Scheduler, a person with curl). There is no clock in here: each call
 * starts exactly one run.
 *
 * Runs triggered over HTTP execute on a fixed worker pool, one thread per
 * run, which caps how many runs can block on sensors and remote jobs at once.
 */
@Service
public class PipelineTrigger {

    private static final Logger log = LoggerFactory.getLogger(PipelineTrigger.class);

    private final PipelineDefinitionFactory definitions;
    private final StepChainExecutor         executor;
    private final PipelineRunService        runService;
    private final ExecutorService           workers;

    public PipelineTrigger(PipelineDefinitionFactory definitions,
                           StepChainExecutor executor,
                           PipelineRunService runService,
                           @Value("${landing.worker-count:2}") int workerCount) {
        this.definitions = definitions;
        this.executor    = executor;
        this.runService  = runService;
        this.workers     = Executors.newFixedThreadPool(workerCount);
    }

    /**
     * Create a PENDING run of the configured pipeline and hand it to a worker.
     * Returns as soon as the run is persisted.
     */
    public PipelineRun trigger() {
        PipelineDefinition definition = definitions.build();
        PipelineRun run = runService.create(definition.name(), definition.steps().size());
        UUID runId = run.getId();
        workers.submit(() -> runInBackground(runId, definition.steps()));
        return run;
    }

    /** Run the configured pipeline on the calling thread and return the finished run. */
    public PipelineRun runNow() {
        PipelineDefinition definition = definitions.build();
        return executor.run(definition.name(), definition.steps());
    }

    // The worker loads its own copy so the instance returned by trigger()
    // is never mutated from another thread.
    private void runInBackground(UUID runId, List<Step> steps) {
        try {
            PipelineRun run = runService.findById(runId).orElseThrow(
                    () -> new IllegalStateException("Run " + runId + " disappeared before it started"));
            executor.execute(run, steps);
        } catch (Exception e) {
            log.error("Run {} aborted by an unhandled error: {}", runId, e.getMessage(), e);
            try {
                runService.abort(runId, "Aborted: " + e.getMessage());
            } catch (Exception abortError) {
                log.warn("Could not mark run {} FAILED, startup recovery will: {}",
                        runId, abortError.getMessage());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        // Interrupts sleeping pollers; their runs are closed out on next startup.
        workers.shutdownNow();
    }
}
