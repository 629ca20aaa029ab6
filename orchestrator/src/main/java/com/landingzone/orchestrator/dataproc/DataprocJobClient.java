package com.landingzone.orchestrator.dataproc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landingzone.orchestrator.dataproc.dto.DataprocJob;
import com.landingzone.orchestrator.dataproc.dto.SubmitJobRequest;
import com.landingzone.orchestrator.engine.ErrorKind;
import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.engine.Sleeper;
import com.landingzone.orchestrator.pipeline.ExecutionSite;
import com.landingzone.orchestrator.pipeline.JobSpec;
import com.landingzone.orchestrator.pipeline.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * {@link RemoteJobClient} for the Dataproc REST API.
 *
 * Submission is asynchronous on the Dataproc side: jobs:submit returns at
 * once with a PENDING job. This client then polls the job resource until it
 * reaches DONE, ERROR or CANCELLED, so callers see a blocking call.
 *
 * The submission itself is never retried. Once the job is accepted, a
 * transport error or 5xx while reading its status is logged and the next
 * poll tries again.
 *
 * Blocking I/O is fine here: each pipeline run has its own worker thread.
 */
@Component
public class DataprocJobClient implements RemoteJobClient {

    private static final Logger log = LoggerFactory.getLogger(DataprocJobClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       accessToken;
    private final Duration     pollInterval;
    private final Duration     maxWait;
    private final Clock        clock;
    private final Sleeper      sleeper;

    public DataprocJobClient(
            @Value("${landing.dataproc.base-url}") String baseUrl,
            @Value("${landing.dataproc.access-token:}") String accessToken,
            @Value("${landing.dataproc.poll-interval:10s}") Duration pollInterval,
            @Value("${landing.dataproc.max-wait:0s}") Duration maxWait,
            ObjectMapper objectMapper,
            Clock clock,
            Sleeper sleeper) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken  = accessToken;
        this.pollInterval = pollInterval;
        this.maxWait      = maxWait;
        this.json         = objectMapper;
        this.clock        = clock;
        this.sleeper      = sleeper;
        this.http         = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // RemoteJobClient
    // ------------------------------------------------------------------

    @Override
    public ExecutionResult submit(JobSpec spec, ExecutionSite target) {
        if (spec == null || !spec.hasBody()) {
            return ExecutionResult.failed(ErrorKind.JOB_SUBMISSION_FAILED, "Job has no query statements");
        }
        if (target == null || !target.isComplete()) {
            return ExecutionResult.failed(ErrorKind.JOB_SUBMISSION_FAILED,
                    "Execution site needs project, region and cluster, got " + target);
        }

        String jobId = spec.jobId();
        try {
            DataprocJob submitted = parse(post(jobsPath(target) + ":submit",
                    toJson(new SubmitJobRequest(toDataprocJob(spec, target))),
                    "submit job " + jobId));
            log.info("Submitted {} job '{}' to {}", spec.type(), jobId, target);

            DataprocJob.Status status = awaitTerminal(target, jobId, submitted.status());
            if (status.isDone()) {
                log.info("Job '{}' DONE", jobId);
                return ExecutionResult.ok("Job " + jobId + " DONE");
            }
            log.warn("Job '{}' ended {}: {}", jobId, status.state(), status.details());
            return ExecutionResult.failed(ErrorKind.JOB_SUBMISSION_FAILED,
                    "Job " + jobId + " ended " + status.state()
                            + (status.details() == null ? "" : ": " + status.details()));
        } catch (JobClientException e) {
            log.warn("Job '{}' failed: {}", jobId, e.getMessage());
            return ExecutionResult.failed(ErrorKind.JOB_SUBMISSION_FAILED, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failed(ErrorKind.JOB_SUBMISSION_FAILED,
                    "Interrupted while waiting for job " + jobId + "; the remote job keeps running");
        }
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    private DataprocJob.Status awaitTerminal(ExecutionSite target, String jobId, DataprocJob.Status initial)
            throws InterruptedException {
        Instant deadline = maxWait.isZero() || maxWait.isNegative() ? null : clock.instant().plus(maxWait);
        DataprocJob.Status status = initial;
        while (status == null || !status.isTerminal()) {
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                throw new JobClientException("Job " + jobId + " still " + stateOf(status)
                        + " after " + maxWait + "; no longer waiting");
            }
            sleeper.sleep(pollInterval);
            status = fetchStatus(target, jobId, status);
            log.debug("Job '{}' is {}", jobId, stateOf(status));
        }
        return status;
    }

    // The job was accepted and keeps running remotely, so a transient failure
    // to read its status only costs one poll; max-wait still bounds the loop.
    private DataprocJob.Status fetchStatus(ExecutionSite target, String jobId, DataprocJob.Status last) {
        try {
            return parse(get(jobsPath(target) + "/" + encode(jobId), "get job " + jobId)).status();
        } catch (JobClientException e) {
            if (!e.isTransient() || Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("Status check for job '{}' failed, polling again: {}", jobId, e.getMessage());
            return last;
        }
    }

    private static String stateOf(DataprocJob.Status status) {
        return status == null ? "UNKNOWN" : status.state();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static DataprocJob toDataprocJob(JobSpec spec, ExecutionSite target) {
        DataprocJob.QueryJob queryJob = new DataprocJob.QueryJob(
                new DataprocJob.QueryList(spec.queries()), spec.properties());
        return new DataprocJob(
                new DataprocJob.Reference(target.projectId(), spec.jobId()),
                new DataprocJob.Placement(target.clusterName()),
                spec.type() == JobType.HIVE      ? queryJob : null,
                spec.type() == JobType.SPARK_SQL ? queryJob : null,
                null);
    }

    private static String jobsPath(ExecutionSite target) {
        return "/v1/projects/" + encode(target.projectId())
                + "/regions/" + encode(target.region()) + "/jobs";
    }

    private String get(String path, String opName) {
        return send(request(path).GET().build(), opName);
    }

    private String post(String path, String jsonBody, String opName) {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build(), opName);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new JobClientException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (JobClientException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobClientException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new JobClientException(opName + " failed", e);
        }
    }

    private DataprocJob parse(String body) {
        try {
            return json.readValue(body, DataprocJob.class);
        } catch (JsonProcessingException e) {
            throw new JobClientException("Failed to parse Dataproc job response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new JobClientException("JSON serialization failed", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
