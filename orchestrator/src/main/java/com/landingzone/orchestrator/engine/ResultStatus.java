package com.landingzone.orchestrator.engine;

/**
 * Outcome of a single step.
 */
public enum ResultStatus {
    OK,
    FAILED,
    TIMED_OUT
}
