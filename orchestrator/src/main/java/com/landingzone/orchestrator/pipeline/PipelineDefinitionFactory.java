package com.landingzone.orchestrator.pipeline;

import com.landingzone.orchestrator.config.PipelineProperties;
import com.landingzone.orchestrator.storage.ObjectLocation;
import com.landingzone.orchestrator.storage.ObjectPattern;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link PipelineProperties} into the step chain
 * {@code sense → job 1 … job n → archive}.
 *
 * Any of the three parts may be left out of the configuration; the ones
 * present keep that order. Configuration errors surface as
 * IllegalArgumentException when the definition is built.
 */
@Component
public class PipelineDefinitionFactory {

    private final PipelineProperties properties;

    public PipelineDefinitionFactory(PipelineProperties properties) {
        this.properties = properties;
    }

    public PipelineDefinition build() {
        List<Step> steps = new ArrayList<>();

        PipelineProperties.Sense sense = properties.sense();
        if (sense != null) {
            steps.add(Step.sense(
                    orDefault(sense.name(), "sense_" + sense.bucket()),
                    new SenseCondition(sense.bucket(), sense.prefix(), sense.pollInterval(), sense.timeout())));
        }

        if (!properties.jobs().isEmpty()) {
            ExecutionSite site = toSite(properties.site());
            for (PipelineProperties.Job job : properties.jobs()) {
                if (job.name() == null || job.name().isBlank()) {
                    throw new IllegalArgumentException("Every job needs a name");
                }
                String jobId = orDefault(job.jobId(), job.name().replace('_', '-'));
                steps.add(Step.submitJob(job.name(),
                        new JobSpec(jobId, job.type(), job.queries(), job.properties()),
                        site));
            }
        }

        PipelineProperties.Archive archive = properties.archive();
        if (archive != null) {
            steps.add(Step.archive(
                    orDefault(archive.name(), "archive_processed_files"),
                    new ArchiveSpec(ObjectPattern.parse(archive.source()),
                            ObjectLocation.parse(archive.destination()),
                            archive.failWhenEmpty())));
        }

        return new PipelineDefinition(properties.name(), steps);
    }

    private static ExecutionSite toSite(PipelineProperties.Site site) {
        if (site == null) {
            throw new IllegalArgumentException("landing.pipeline.site is required when jobs are configured");
        }
        ExecutionSite target = new ExecutionSite(site.projectId(), site.region(), site.clusterName());
        if (!target.isComplete()) {
            throw new IllegalArgumentException("landing.pipeline.site needs project-id, region and cluster-name");
        }
        return target;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
