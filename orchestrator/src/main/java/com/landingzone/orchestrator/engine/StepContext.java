package com.landingzone.orchestrator.engine;

import java.util.UUID;

/**
 * Runtime context passed to every step handler: the owning run and the
 * step's position in the chain.
 */
public record StepContext(UUID runId, int stepIndex) {}
