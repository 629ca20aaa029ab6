package com.landingzone.orchestrator.repository;

import com.landingzone.orchestrator.model.StepExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for the step_executions table.
 */
public interface StepExecutionRepository extends JpaRepository<StepExecution, UUID> {

    /** All executed steps of a run, in chain order. */
    List<StepExecution> findByRunIdOrderByStepIndexAsc(UUID runId);
}
