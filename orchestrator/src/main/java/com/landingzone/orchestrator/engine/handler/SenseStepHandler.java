package com.landingzone.orchestrator.engine.handler;

import com.landingzone.orchestrator.engine.ConditionPoller;
import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.engine.StepContext;
import com.landingzone.orchestrator.engine.StepHandler;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;
import org.springframework.stereotype.Component;

@Component
public class SenseStepHandler implements StepHandler {

    private final ConditionPoller poller;

    public SenseStepHandler(ConditionPoller poller) {
        this.poller = poller;
    }

    @Override public StepKind kind() { return StepKind.SENSE; }

    @Override
    public ExecutionResult execute(Step step, StepContext ctx) {
        return poller.await(step.sense());
    }
}
