package com.landingzone.orchestrator.model;

import com.landingzone.orchestrator.engine.ResultStatus;

/**
 * Lifecycle of a {@link PipelineRun}.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCEEDED | FAILED | TIMED_OUT
 *
 * Forward only. A run that was still PENDING or RUNNING when its process
 * died is moved straight to FAILED on the next startup.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    /** Terminal run status for a chain that stopped on a step with the given result. */
    public static RunStatus stoppedBy(ResultStatus result) {
        return switch (result) {
            case OK        -> SUCCEEDED;
            case FAILED    -> FAILED;
            case TIMED_OUT -> TIMED_OUT;
        };
    }
}
