package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;

/**
 * Executes every step of one {@link StepKind}.
 *
 * Handlers report failure through the returned {@link ExecutionResult}.
 * Anything they throw is caught by {@link StepHandlerRegistry} and turned
 * into a FAILED result, so exceptions never reach the executor.
 */
public interface StepHandler {

    /** The step kind this handler is registered for. */
    StepKind kind();

    ExecutionResult execute(Step step, StepContext ctx);
}
