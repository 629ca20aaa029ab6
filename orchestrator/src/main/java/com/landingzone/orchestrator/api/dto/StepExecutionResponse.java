package com.landingzone.orchestrator.api.dto;

import com.landingzone.orchestrator.engine.ErrorKind;
import com.landingzone.orchestrator.engine.ResultStatus;
import com.landingzone.orchestrator.model.StepExecution;
import com.landingzone.orchestrator.pipeline.StepKind;

import java.time.Instant;

/**
 * Read-only view of one executed step, returned by GET /runs/{id}/steps.
 */
public record StepExecutionResponse(
        int          index,
        String       name,
        StepKind     kind,
        ResultStatus status,
        ErrorKind    errorKind,
        String       detail,
        int          objectsAffected,
        Instant      startedAt,
        Instant      finishedAt
) {
    public static StepExecutionResponse from(StepExecution s) {
        return new StepExecutionResponse(
                s.getStepIndex(),
                s.getStepName(),
                s.getKind(),
                s.getStatus(),
                s.getErrorKind(),
                s.getDetail(),
                s.getObjectsAffected(),
                s.getStartedAt(),
                s.getFinishedAt()
        );
    }
}
