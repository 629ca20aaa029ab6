package com.landingzone.orchestrator.dataproc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * The Dataproc Job resource, trimmed to the fields we send and read.
 * Field names match the REST API's JSON (camelCase).
 *
 * Exactly one of hiveJob / sparkSqlJob is set on submission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataprocJob(
        Reference reference,
        Placement placement,
        QueryJob  hiveJob,
        QueryJob  sparkSqlJob,
        Status    status
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Reference(String projectId, String jobId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Placement(String clusterName) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryJob(QueryList queryList, Map<String, String> properties) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryList(List<String> queries) {}

    /**
     * state is one of PENDING, SETUP_DONE, RUNNING, CANCEL_PENDING,
     * CANCEL_STARTED, CANCELLED, DONE, ERROR, ATTEMPT_FAILURE.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(String state, String details, String stateStartTime) {

        public boolean isTerminal() {
            return "DONE".equals(state) || "ERROR".equals(state) || "CANCELLED".equals(state);
        }

        public boolean isDone() {
            return "DONE".equals(state);
        }
    }
}
