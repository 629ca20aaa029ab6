package com.landingzone.orchestrator.model;

import com.landingzone.orchestrator.engine.ErrorKind;
import com.landingzone.orchestrator.engine.ExecutionResult;
import com.landingzone.orchestrator.engine.ResultStatus;
import com.landingzone.orchestrator.pipeline.Step;
import com.landingzone.orchestrator.pipeline.StepKind;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Record of one executed step of a {@link PipelineRun}. Written once, after
 * the step returns; steps that never ran have no row.
 *
 * DB table: step_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_executions")
public class StepExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private PipelineRun run;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(name = "step_name", nullable = false)
    private String stepName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ResultStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private ErrorKind errorKind;

    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(name = "objects_affected", nullable = false)
    private int objectsAffected;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;

    protected StepExecution() {}   // required by JPA

    public StepExecution(PipelineRun run, int stepIndex, Step step,
                         ExecutionResult result, Instant startedAt, Instant finishedAt) {
        this.run             = run;
        this.stepIndex       = stepIndex;
        this.stepName        = step.name();
        this.kind            = step.kind();
        this.status          = result.status();
        this.errorKind       = result.errorKind();
        this.detail          = result.detail();
        this.objectsAffected = result.objectsAffected();
        this.startedAt       = startedAt;
        this.finishedAt      = finishedAt;
    }

    public UUID         getId()              { return id; }
    public PipelineRun  getRun()             { return run; }
    public int          getStepIndex()       { return stepIndex; }
    public String       getStepName()        { return stepName; }
    public StepKind     getKind()            { return kind; }
    public ResultStatus getStatus()          { return status; }
    public ErrorKind    getErrorKind()       { return errorKind; }
    public String       getDetail()          { return detail; }
    public int          getObjectsAffected() { return objectsAffected; }
    public Instant      getStartedAt()       { return startedAt; }
    public Instant      getFinishedAt()      { return finishedAt; }
}
