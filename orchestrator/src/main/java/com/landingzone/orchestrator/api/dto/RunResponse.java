package com.landingzone.orchestrator.api.dto;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 *
 * failedStepName / failedStepIndex / errorDetail are only set when the run
 * stopped on a step that was not OK.
 */
public record RunResponse(
        UUID      id,
        String    pipelineName,
        RunStatus status,
        int       stepCount,
        int       currentStepIndex,
        String    failedStepName,
        Integer   failedStepIndex,
        String    errorDetail,
        Instant   createdAt,
        Instant   startedAt,
        Instant   finishedAt
) {
    public static RunResponse from(PipelineRun run) {
        return new RunResponse(
                run.getId(),
                run.getPipelineName(),
                run.getStatus(),
                run.getStepCount(),
                run.getCurrentStepIndex(),
                run.getFailedStepName(),
                run.getFailedStepIndex(),
                run.getErrorDetail(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
