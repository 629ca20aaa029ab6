package com.landingzone.orchestrator.service;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import com.landingzone.orchestrator.model.StepExecution;
import com.landingzone.orchestrator.repository.PipelineRunRepository;
import com.landingzone.orchestrator.repository.StepExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence side of the run lifecycle.
 *
 * The executor owns the state transitions on {@link PipelineRun}; this
 * service only stores what it is handed and answers the reporting queries.
 */
@Service
public class PipelineRunService {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunService.class);

    private final PipelineRunRepository   runRepo;
    private final StepExecutionRepository stepRepo;
    private final Clock                   clock;

    // Runs created before this instant belong to an earlier process.
    private final Instant bootTime;

    public PipelineRunService(PipelineRunRepository runRepo,
                              StepExecutionRepository stepRepo,
                              Clock clock) {
        this.runRepo  = runRepo;
        this.stepRepo = stepRepo;
        this.clock    = clock;
        this.bootTime = clock.instant();
    }

    // ------------------------------------------------------------------
    // Writes (called by the executor and the trigger)
    // ------------------------------------------------------------------

    /** Persist a new PENDING run and return it with its id assigned. */
    @Transactional
    public PipelineRun create(String pipelineName, int stepCount) {
        PipelineRun run = runRepo.save(new PipelineRun(pipelineName, stepCount));
        log.info("Created run {} of pipeline '{}' ({} steps)", run.getId(), pipelineName, stepCount);
        return run;
    }

    @Transactional
    public void save(PipelineRun run) {
        runRepo.save(run);
    }

    @Transactional
    public void recordStep(StepExecution execution) {
        stepRepo.save(execution);
    }

    /** Close out a run whose worker died on an unexpected error. */
    @Transactional
    public void abort(UUID runId, String detail) {
        runRepo.findById(runId)
                .filter(run -> !run.getStatus().isTerminal())
                .ifPresent(run -> {
                    run.interrupt(detail, clock.instant());
                    runRepo.save(run);
                });
    }

    // ------------------------------------------------------------------
    // Reads (called by the REST API)
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<PipelineRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    /** Most recent first, optionally restricted to one status. */
    @Transactional(readOnly = true)
    public List<PipelineRun> list(RunStatus status) {
        return status == null
                ? runRepo.findAllByOrderByCreatedAtDesc()
                : runRepo.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional(readOnly = true)
    public List<StepExecution> getSteps(UUID runId) {
        return stepRepo.findByRunIdOrderByStepIndexAsc(runId);
    }

    // ------------------------------------------------------------------
    // Startup recovery
    // ------------------------------------------------------------------

    /**
     * Close out runs a previous process left PENDING or RUNNING.
     *
     * Nothing resumes them: every step is safe to repeat, so the recovery
     * path is simply triggering the pipeline again.
     */
    @EventListener(ApplicationStartedEvent.class)
    @Transactional
    public void recoverInterruptedRuns() {
        List<PipelineRun> stale = runRepo.findByStatusInAndCreatedAtBefore(
                EnumSet.of(RunStatus.PENDING, RunStatus.RUNNING), bootTime);
        for (PipelineRun run : stale) {
            log.warn("Marking run {} FAILED: left {} at step {} by a previous process",
                    run.getId(), run.getStatus(), run.getCurrentStepIndex());
            run.interrupt("Interrupted: process stopped before the run finished", clock.instant());
            runRepo.save(run);
        }
    }
}
