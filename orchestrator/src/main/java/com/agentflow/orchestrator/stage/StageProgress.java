package com.agentflow.orchestrator.stage;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable resume state for one repository's pipeline run.
 *
 * Exactly one row per repository, keyed by {@link RepositorySlug#progressKey}.
 * The stage is stored as text so that a value written by a newer deployment
 * still loads here; {@link PipelineStage#fromValue} decides whether it is
 * known.
 *
 * DB table: stage_progress  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_progress")
public class StageProgress {

    @Id
    @Column(name = "progress_key", nullable = false, updatable = false)
    private String progressKey;

    @Column(nullable = false)
    private String repository;

    @Column(name = "task_id", nullable = false)
    private String taskId;

    @Column
    private String branch;

    @Column(nullable = false)
    private String stage = PipelineStage.IMPLEMENTATION.value();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProgressStatus status = ProgressStatus.IN_PROGRESS;

    // Identifies the agent process of the current attempt (null between attempts).
    @Column(name = "run_handle")
    private String runHandle;

    // Failed attempts of the current stage; reset on every transition.
    @Column(nullable = false)
    private int attempt = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.lastUpdated = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StageProgress() {}   // required by JPA

    public StageProgress(String repository, String taskId, String branch) {
        this.progressKey = RepositorySlug.progressKey(repository);
        this.repository  = repository;
        this.taskId      = taskId;
        this.branch      = branch;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** Move to a new stage: attempt counter and error are reset. */
    public void advanceTo(PipelineStage next) {
        this.stage     = next.value();
        this.status    = next.isTerminal() ? ProgressStatus.COMPLETED : ProgressStatus.IN_PROGRESS;
        this.attempt   = 0;
        this.lastError = null;
        this.runHandle = null;
        touch();
    }

    public void recordFailedAttempt(String error) {
        this.attempt++;
        this.lastError = error;
        touch();
    }

    /** Give the current stage a fresh attempt budget (operator re-trigger after a failure). */
    public void resetAttempts() {
        this.attempt   = 0;
        this.runHandle = null;
    }

    public void touch() {
        this.lastUpdated = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String         getProgressKey() { return progressKey; }
    public String         getRepository()  { return repository; }
    public String         getTaskId()      { return taskId; }
    public String         getBranch()      { return branch; }
    public String         getStage()       { return stage; }
    public ProgressStatus getStatus()      { return status; }
    public String         getRunHandle()   { return runHandle; }
    public int            getAttempt()     { return attempt; }
    public String         getLastError()   { return lastError; }
    public Instant        getStartedAt()   { return startedAt; }
    public Instant        getLastUpdated() { return lastUpdated; }

    public void setStage(String stage)              { this.stage = stage; }
    public void setStatus(ProgressStatus status)    { this.status = status; }
    public void setRunHandle(String runHandle)      { this.runHandle = runHandle; }
    public void setLastError(String lastError)      { this.lastError = lastError; }
    public void setBranch(String branch)            { this.branch = branch; }
}
