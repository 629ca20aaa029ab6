package com.landingzone.orchestrator.config;

import com.landingzone.orchestrator.pipeline.JobType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The pipeline definition, bound from {@code landing.pipeline.*}.
 *
 * Everything environment-specific (buckets, cluster, project, query text)
 * lives here so the engine itself carries no hard-coded names.
 */
@ConfigurationProperties(prefix = "landing.pipeline")
public record PipelineProperties(
        String     name,
        Site       site,
        Sense      sense,
        List<Job>  jobs,
        Archive    archive
) {
    public PipelineProperties {
        if (jobs == null) jobs = List.of();
    }

    public record Site(String projectId, String region, String clusterName) {}

    public record Sense(String name, String bucket, String prefix, Duration pollInterval, Duration timeout) {}

    public record Job(String name, String jobId, JobType type, List<String> queries,
                      Map<String, String> properties) {}

    public record Archive(String name, String source, String destination, boolean failWhenEmpty) {}
}
