package com.landingzone.orchestrator.dataproc;

import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.pipeline.ExecutionSite;
import com.landingzone.orchestrator.pipeline.JobSpec;

/**
 * Submits a job to a remote compute service and blocks until it finishes.
 *
 * No retries: a failed submission or a failed job is reported as FAILED
 * straight away. Side effects of a failed job are left in place.
 */
public interface RemoteJobClient {

    ExecutionResult submit(JobSpec spec, ExecutionSite target);
}
