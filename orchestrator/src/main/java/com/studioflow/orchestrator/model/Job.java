package com.studioflow.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One trackable unit of asynchronous work.
 *
 * inputData and resultData are JSON documents the queue never interprets;
 * only the handler registered for {@link #getType()} knows their schema.
 *
 * claimedBy / claimExpiresAt form a short lease written by claimBatch. The
 * row stays PENDING while leased, and a lease that runs out (the claimant
 * crashed before calling start) makes the row claimable again.
 *
 * DB table: job  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "project_id")
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    // Self reference kept as a plain column; parents are always inserted first,
    // so a cycle cannot be built.
    @Column(name = "parent_job_id", updatable = false)
    private UUID parentJobId;

    // Informal lineage for rows produced by retry().
    @Column(name = "retried_from_id", updatable = false)
    private UUID retriedFromId;

    @Column(nullable = false)
    private int progress = 0;

    @Column(name = "current_step", nullable = false)
    private int currentStep = 0;

    @Column(name = "total_steps")
    private Integer totalSteps;

    @Column(name = "progress_message", columnDefinition = "TEXT")
    private String progressMessage;

    @Column(name = "input_data", columnDefinition = "TEXT")
    private String inputData;

    @Column(name = "result_data", columnDefinition = "TEXT")
    private String resultData;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "is_imported", nullable = false)
    private boolean imported = false;

    @Column(name = "claimed_by")
    private String claimedBy;

    @Column(name = "claim_expires_at")
    private Instant claimExpiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String userId, String projectId, JobType type, String inputData, Integer totalSteps) {
        this.userId     = userId;
        this.projectId  = projectId;
        this.type       = type;
        this.inputData  = inputData;
        this.totalSteps = totalSteps;
    }

    /** Fresh PENDING copy of a failed or cancelled job. */
    public static Job retryOf(Job original) {
        Job copy = new Job(original.userId, original.projectId, original.type,
                original.inputData, original.totalSteps);
        copy.parentJobId   = original.parentJobId;
        copy.retriedFromId = original.id;
        return copy;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()              { return id; }
    public String    getUserId()          { return userId; }
    public String    getProjectId()       { return projectId; }
    public JobType   getType()            { return type; }
    public JobStatus getStatus()          { return status; }
    public UUID      getParentJobId()     { return parentJobId; }
    public UUID      getRetriedFromId()   { return retriedFromId; }
    public int       getProgress()        { return progress; }
    public int       getCurrentStep()     { return currentStep; }
    public Integer   getTotalSteps()      { return totalSteps; }
    public String    getProgressMessage() { return progressMessage; }
    public String    getInputData()       { return inputData; }
    public String    getResultData()      { return resultData; }
    public String    getErrorMessage()    { return errorMessage; }
    public boolean   isImported()         { return imported; }
    public String    getClaimedBy()       { return claimedBy; }
    public Instant   getClaimExpiresAt()  { return claimExpiresAt; }
    public Instant   getCreatedAt()       { return createdAt; }
    public Instant   getStartedAt()       { return startedAt; }
    public Instant   getCompletedAt()     { return completedAt; }
    public Instant   getUpdatedAt()       { return updatedAt; }

    public void setStatus(JobStatus status)            { this.status = status; }
    public void setParentJobId(UUID parentJobId)       { this.parentJobId = parentJobId; }
    public void setCurrentStep(int currentStep)        { this.currentStep = currentStep; }
    public void setProgressMessage(String message)     { this.progressMessage = message; }
    public void setInputData(String inputData)         { this.inputData = inputData; }
    public void setResultData(String resultData)       { this.resultData = resultData; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setImported(boolean imported)          { this.imported = imported; }
    public void setStartedAt(Instant t)                { this.startedAt = t; }
    public void setCreatedAt(Instant t)                { this.createdAt = t; }

    /** Stores progress clamped into [0, 100]. */
    public void setProgress(int progress) {
        this.progress = Math.max(0, Math.min(100, progress));
    }

    public void lease(String claimant, Instant expiresAt) {
        this.claimedBy      = claimant;
        this.claimExpiresAt = expiresAt;
    }

    public void releaseLease() {
        this.claimedBy      = null;
        this.claimExpiresAt = null;
    }

    /** Moves into a terminal status; completedAt is written only on the first terminal transition. */
    public void terminate(JobStatus terminal, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        this.status = terminal;
        if (this.completedAt == null) {
            this.completedAt = at;
        }
        releaseLease();
    }
}
