package com.landingzone.orchestrator.pipeline;

/**
 * Where a remote job runs: GCP project, Dataproc region and cluster.
 */
public record ExecutionSite(String projectId, String region, String clusterName) {

    public boolean isComplete() {
        return notBlank(projectId) && notBlank(region) && notBlank(clusterName);
    }

    @Override
    public String toString() {
        return projectId + "/" + region + "/" + clusterName;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
