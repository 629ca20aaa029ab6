package com.landingzone.orchestrator.pipeline;

/**
 * Query engines a submitted job can target on the cluster.
 */
public enum JobType {
    HIVE,
    SPARK_SQL
}
