package com.landingzone.orchestrator.pipeline;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Opaque description of one unit of remote work.
 *
 * The body is the ordered list of query statements; the client never
 * interprets them, it only reports whether the remote engine accepted and
 * finished them.
 *
 * @param jobId      base name of the remote job reference, e.g. "create-hive-db"
 * @param type       which query engine runs the body
 * @param queries    statements executed in order by the remote engine
 * @param properties engine properties (e.g. hive.exec.dynamic.partition), may be empty
 */
public record JobSpec(
        String              jobId,
        JobType             type,
        List<String>        queries,
        Map<String, String> properties
) {
    public JobSpec {
        if (type == null) type = JobType.HIVE;
        queries    = queries    == null ? List.of() : List.copyOf(queries);
        properties = properties == null ? Map.of()  : Map.copyOf(properties);
    }

    public JobSpec(String jobId, List<String> queries) {
        this(jobId, JobType.HIVE, queries, Map.of());
    }

    /** True when there is at least one non-blank statement to run. */
    public boolean hasBody() {
        return queries.stream().anyMatch(q -> q != null && !q.isBlank());
    }

    /**
     * Copy whose job id is unique to one pipeline run. Dataproc rejects a
     * second submission with an id it has already seen, so the daily
     * re-trigger would fail without it.
     */
    public JobSpec forRun(UUID runId) {
        String suffix = runId.toString().substring(0, 8);
        return new JobSpec(jobId + "-" + suffix, type, queries, properties);
    }
}
