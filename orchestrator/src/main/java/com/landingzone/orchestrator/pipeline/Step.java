package com.landingzone.orchestrator.pipeline;

/**
 * One immutable entry of a pipeline's step chain.
 *
 * Exactly the parameters belonging to {@link #kind()} are set; the others
 * are null. Build instances through the static factories.
 */
public record Step(
        String         name,
        StepKind       kind,
        SenseCondition sense,
        JobSpec        job,
        ExecutionSite  site,
        ArchiveSpec    archive
) {
    public Step {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Step kind is required for step '" + name + "'");
        }
        boolean complete = switch (kind) {
            case SENSE      -> sense != null;
            case SUBMIT_JOB -> job != null && site != null;
            case ARCHIVE    -> archive != null;
        };
        if (!complete) {
            throw new IllegalArgumentException(
                    "Step '" + name + "' of kind " + kind + " is missing its parameters");
        }
    }

    public static Step sense(String name, SenseCondition condition) {
        return new Step(name, StepKind.SENSE, condition, null, null, null);
    }

    public static Step submitJob(String name, JobSpec job, ExecutionSite site) {
        return new Step(name, StepKind.SUBMIT_JOB, null, job, site, null);
    }

    public static Step archive(String name, ArchiveSpec archive) {
        return new Step(name, StepKind.ARCHIVE, null, null, null, archive);
    }
}
