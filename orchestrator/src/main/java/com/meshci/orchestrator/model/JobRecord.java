package com.meshci.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted status of one Job inside a Run.
 *
 * One row is created per declared job when the Run is submitted (status
 * PENDING) and updated by the DAG runner as the job moves through its
 * lifecycle. Step results are stored as a JSON array so the API can show
 * which step failed and which advisory steps were tolerated.
 *
 * DB table: run_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "run_jobs")
public class JobRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Column(nullable = false)
    private String name;

    // Comma-separated upstream job names, informational.
    @Column(name = "depends_on", columnDefinition = "TEXT")
    private String dependsOn;

    @Column(nullable = false)
    private boolean gate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "step_results", columnDefinition = "TEXT")
    private String stepResultsJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobRecord() {}   // required by JPA

    public JobRecord(Run run, String name, String dependsOn, boolean gate) {
        this.run       = run;
        this.name      = name;
        this.dependsOn = dependsOn;
        this.gate      = gate;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()              { return id; }
    public Run       getRun()             { return run; }
    public String    getName()            { return name; }
    public String    getDependsOn()       { return dependsOn; }
    public boolean   isGate()             { return gate; }
    public JobStatus getStatus()          { return status; }
    public String    getFailureReason()   { return failureReason; }
    public String    getStepResultsJson() { return stepResultsJson; }
    public Instant   getCreatedAt()       { return createdAt; }
    public Instant   getStartedAt()       { return startedAt; }
    public Instant   getFinishedAt()      { return finishedAt; }

    public void setStatus(JobStatus status)          { this.status = status; }
    public void setFailureReason(String reason)      { this.failureReason = reason; }
    public void setStepResultsJson(String json)      { this.stepResultsJson = json; }
    public void setStartedAt(Instant t)              { this.startedAt = t; }
    public void setFinishedAt(Instant t)             { this.finishedAt = t; }
}
