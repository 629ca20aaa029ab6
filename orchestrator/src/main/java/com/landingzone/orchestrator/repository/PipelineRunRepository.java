package com.landingzone.orchestrator.repository;

import com.landingzone.orchestrator.model.PipelineRun;
import com.landingzone.orchestrator.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the pipeline_runs table.
 */
public interface PipelineRunRepository extends JpaRepository<PipelineRun, UUID> {

    List<PipelineRun> findAllByOrderByCreatedAtDesc();

    List<PipelineRun> findByStatusOrderByCreatedAtDesc(RunStatus status);

    /** Non-terminal runs created before {@code cutoff}, i.e. by an earlier process. */
    List<PipelineRun> findByStatusInAndCreatedAtBefore(Collection<RunStatus> statuses, Instant cutoff);
}
