package com.landingzone.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a pipeline's step chain.
 *
 * Only the executor changes a run, and only through the transition methods
 * below, which reject anything but a forward move of the state machine.
 *
 * DB table: pipeline_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_runs")
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_name", nullable = false)
    private String pipelineName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "step_count", nullable = false)
    private int stepCount;

    // -1 until the first step starts.
    @Column(name = "current_step_index", nullable = false)
    private int currentStepIndex = -1;

    // Set only when the run stops on a non-OK step.
    @Column(name = "failed_step_name")
    private String failedStepName;

    @Column(name = "failed_step_index")
    private Integer failedStepIndex;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineRun() {}   // required by JPA

    public PipelineRun(String pipelineName, int stepCount) {
        this.pipelineName = pipelineName;
        this.stepCount    = stepCount;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    public void start(Instant at) {
        requireStatus(RunStatus.PENDING, "start");
        this.status    = RunStatus.RUNNING;
        this.startedAt = at;
    }

    public void advanceTo(int stepIndex) {
        requireStatus(RunStatus.RUNNING, "advance");
        if (stepIndex <= currentStepIndex || stepIndex >= stepCount) {
            throw new IllegalStateException("Run " + id + " cannot move from step "
                    + currentStepIndex + " to step " + stepIndex + " of " + stepCount);
        }
        this.currentStepIndex = stepIndex;
    }

    public void succeed(Instant at) {
        requireStatus(RunStatus.RUNNING, "succeed");
        this.status     = RunStatus.SUCCEEDED;
        this.finishedAt = at;
    }

    public void stop(RunStatus terminal, int stepIndex, String stepName, String detail, Instant at) {
        if (terminal != RunStatus.FAILED && terminal != RunStatus.TIMED_OUT) {
            throw new IllegalArgumentException("A stopped run ends FAILED or TIMED_OUT, not " + terminal);
        }
        requireStatus(RunStatus.RUNNING, "stop");
        this.status          = terminal;
        this.failedStepIndex = stepIndex;
        this.failedStepName  = stepName;
        this.errorDetail     = detail;
        this.finishedAt      = at;
    }

    /** Close out a run whose process died before it reached a terminal status. */
    public void interrupt(String detail, Instant at) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " already finished as " + status);
        }
        this.status      = RunStatus.FAILED;
        this.errorDetail = detail;
        this.finishedAt  = at;
        if (currentStepIndex >= 0) {
            this.failedStepIndex = currentStepIndex;
        }
    }

    private void requireStatus(RunStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Cannot " + action + " run " + id + " in status " + status + " (expected " + expected + ")");
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID      getId()               { return id; }
    public String    getPipelineName()     { return pipelineName; }
    public RunStatus getStatus()           { return status; }
    public int       getStepCount()        { return stepCount; }
    public int       getCurrentStepIndex() { return currentStepIndex; }
    public String    getFailedStepName()   { return failedStepName; }
    public Integer   getFailedStepIndex()  { return failedStepIndex; }
    public String    getErrorDetail()      { return errorDetail; }
    public Instant   getCreatedAt()        { return createdAt; }
    public Instant   getStartedAt()        { return startedAt; }
    public Instant   getFinishedAt()       { return finishedAt; }
    public Instant   getUpdatedAt()        { return updatedAt; }
}
