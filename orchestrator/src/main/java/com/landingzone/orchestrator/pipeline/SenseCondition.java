package com.landingzone.orchestrator.pipeline;

import java.time.Duration;

/**
 * "At least one object under {@code prefix} exists in {@code bucket}",
 * checked every {@code pollInterval} until {@code timeout} elapses.
 */
public record SenseCondition(
        String   bucket,
        String   prefix,
        Duration pollInterval,
        Duration timeout
) {
    public SenseCondition {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Sense bucket is required");
        }
        if (prefix == null) prefix = "";
        if (pollInterval == null || timeout == null) {
            throw new IllegalArgumentException("Sense poll interval and timeout are required");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval);
        }
        if (pollInterval.compareTo(timeout) > 0) {
            throw new IllegalArgumentException(
                    "Poll interval " + pollInterval + " exceeds timeout " + timeout);
        }
    }

    /** gs:// form, used in log lines and result details. */
    public String describe() {
        return "gs://" + bucket + "/" + prefix;
    }
}
