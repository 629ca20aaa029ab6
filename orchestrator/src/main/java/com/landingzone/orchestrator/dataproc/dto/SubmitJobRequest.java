package com.landingzone.orchestrator.dataproc.dto;

/**
 * Request body for POST .../regions/{region}/jobs:submit.
 */
public record SubmitJobRequest(DataprocJob job) {}
