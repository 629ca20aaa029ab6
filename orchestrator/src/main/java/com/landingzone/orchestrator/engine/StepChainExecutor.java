package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import com.landingzone.orchestrator.model.StepExecution;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.service.PipelineRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs a step chain strictly in order and stops at the first step that is
 * not OK.
 *
 * Each step's postcondition is the next step's precondition (the file must
 * exist before the table over it is created, the load must finish before
 * the file is archived), so there is no parallelism and no branching: the
 * run is a linear fold over the step list.
 *
 * The executor holds no per-run state of its own; everything lives on the
 * {@link PipelineRun} passed in, so concurrent runs on different threads
 * never see each other.
 */
@Component
public class StepChainExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepChainExecutor.class);

    private final StepHandlerRegistry handlers;
    private final PipelineRunService  runService;
    private final Clock               clock;

    public StepChainExecutor(StepHandlerRegistry handlers,
                             PipelineRunService runService,
                             Clock clock) {
        this.handlers   = handlers;
        this.runService = runService;
        this.clock      = clock;
    }

    /** Create a run for {@code steps} and execute it on the calling thread. */
    public PipelineRun run(String pipelineName, List<Step> steps) {
        requireSteps(steps);
        PipelineRun run = runService.create(pipelineName, steps.size());
        return execute(run, steps);
    }

    /**
     * Execute a PENDING run to a terminal status. Blocks until the chain
     * finishes or stops.
     */
    public PipelineRun execute(PipelineRun run, List<Step> steps) {
        requireSteps(steps);
        if (steps.size() != run.getStepCount()) {
            throw new IllegalArgumentException("Run " + run.getId() + " expects " + run.getStepCount()
                    + " steps, got " + steps.size());
        }

        MDC.put("runId", String.valueOf(run.getId()));
        try {
            run.start(clock.instant());
            runService.save(run);
            log.info("Run {} of '{}' started with {} steps", run.getId(), run.getPipelineName(), steps.size());

            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                ExecutionResult result = executeStep(run, i, step);

                if (!result.isOk()) {
                    run.stop(RunStatus.stoppedBy(result.status()), i, step.name(), result.detail(), clock.instant());
                    runService.save(run);
                    log.error("Run {} {} at step {} '{}': {}",
                            run.getId(), run.getStatus(), i, step.name(), result.detail());
                    return run;
                }
            }

            run.succeed(clock.instant());
            runService.save(run);
            log.info("Run {} SUCCEEDED", run.getId());
            return run;
        } finally {
            // Pooled workers and one-shot callers keep their own MDC entries.
            MDC.remove("runId");
        }
    }

    private ExecutionResult executeStep(PipelineRun run, int index, Step step) {
        MDC.put("step",      step.name());
        MDC.put("stepIndex", String.valueOf(index));
        try {
            run.advanceTo(index);
            runService.save(run);
            log.info("Step {} '{}' ({}) starting", index, step.name(), step.kind());

            Instant started = clock.instant();
            ExecutionResult result = handlers.execute(step, new StepContext(run.getId(), index));
            runService.recordStep(new StepExecution(run, index, step, result, started, clock.instant()));

            log.info("Step {} '{}' finished {}: {}", index, step.name(), result.status(), result.detail());
            return result;
        } finally {
            MDC.remove("step");
            MDC.remove("stepIndex");
        }
    }

    private static void requireSteps(List<Step> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one step");
        }
    }
}
