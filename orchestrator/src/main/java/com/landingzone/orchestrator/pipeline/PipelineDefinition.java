package com.landingzone.orchestrator.pipeline;

import java.util.List;

/**
 * A named, ordered step chain. Built by the caller and handed to the
 * executor; there is no registry of pipelines.
 */
public record PipelineDefinition(String name, List<Step> steps) {

    public PipelineDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline name is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Pipeline '" + name + "' has no steps");
        }
        steps = List.copyOf(steps);
        long distinct = steps.stream().map(Step::name).distinct().count();
        if (distinct != steps.size()) {
            throw new IllegalArgumentException("Pipeline '" + name + "' has duplicate step names");
        }
    }
}
