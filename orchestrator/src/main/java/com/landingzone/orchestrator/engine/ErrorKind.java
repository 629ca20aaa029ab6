package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.pipeline.StepKind;

/**
 * Why a step did not return {@link ResultStatus#OK}.
 */
public enum ErrorKind {
    SENSE_TIMEOUT,          // condition never satisfied before the deadline
    SENSE_FAILED,           // sensing aborted for a reason other than the deadline
    JOB_SUBMISSION_FAILED,  // remote job errored, or could not be submitted at all
    ARCHIVE_FAILED;         // one or more objects could not be relocated

    /** Error kind to report when a handler of the given kind fails unexpectedly. */
    public static ErrorKind failureOf(StepKind kind) {
        return switch (kind) {
            case SENSE      -> SENSE_FAILED;
            case SUBMIT_JOB -> JOB_SUBMISSION_FAILED;
            case ARCHIVE    -> ARCHIVE_FAILED;
        };
    }
}
