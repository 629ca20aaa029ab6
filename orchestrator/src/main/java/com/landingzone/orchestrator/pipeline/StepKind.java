package com.landingzone.orchestrator.pipeline;

/**
 * What a pipeline step does, and therefore which handler runs it.
 */
public enum StepKind {
    SENSE,        // wait until an object with a prefix exists
    SUBMIT_JOB,   // run one remote job to completion
    ARCHIVE       // move processed inputs to the archive location
}
