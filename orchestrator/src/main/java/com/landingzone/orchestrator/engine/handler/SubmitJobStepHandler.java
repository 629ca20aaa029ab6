package com.landingzone.orchestrator.engine.handler;

import com.landingzone.orchestrator.dataproc.RemoteJobClient;
import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.engine.StepContext;
import com.landingzone.orchestrator.engine.StepHandler;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;
import org.springframework.stereotype.Component;

/**
 * Submits the step's job under a run-specific job id, so the same pipeline
 * can be triggered again the next day.
 */
@Component
public class SubmitJobStepHandler implements StepHandler {

    private final RemoteJobClient jobClient;

    public SubmitJobStepHandler(RemoteJobClient jobClient) {
        this.jobClient = jobClient;
    }

    @Override public StepKind kind() { return StepKind.SUBMIT_JOB; }

    @Override
    public ExecutionResult execute(Step step, StepContext ctx) {
        return jobClient.submit(step.job().forRun(ctx.runId()), step.site());
    }
}
