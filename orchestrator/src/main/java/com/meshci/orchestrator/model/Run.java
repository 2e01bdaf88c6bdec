package com.meshci.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One execution of the job DAG for one trigger event.
 *
 * The run id doubles as the artifact key of the build: every job of the run
 * fetches the binaries published under it.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String workflow;

    @Column(name = "git_ref", nullable = false)
    private String gitRef;

    @Column(name = "pr_number")
    private Integer prNumber;

    // workflow + PR number (or ref); at most one active run per group.
    @Column(name = "concurrency_group", nullable = false)
    private String concurrencyGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_kind", nullable = false)
    private TriggerKind triggerKind;

    @Column(name = "head_commit_message", columnDefinition = "TEXT")
    private String headCommitMessage;

    @Column(name = "pr_title")
    private String prTitle;

    private String actor;

    @Column(name = "repository_owner")
    private String repositoryOwner;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.QUEUED;

    // Mirrors the status of the gate job; the only value the merge bot reads.
    @Enumerated(EnumType.STRING)
    @Column(name = "gate_status", nullable = false)
    private JobStatus gateStatus = JobStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<JobRecord> jobs = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(TriggerEvent event) {
        this.workflow          = event.workflow();
        this.gitRef            = event.ref();
        this.prNumber          = event.prNumber();
        this.concurrencyGroup  = event.concurrencyGroup();
        this.triggerKind       = event.kind();
        this.headCommitMessage = event.headCommitMessage();
        this.prTitle           = event.prTitle();
        this.actor             = event.actor();
        this.repositoryOwner   = event.repositoryOwner();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()                { return id; }
    public String      getWorkflow()          { return workflow; }
    public String      getGitRef()            { return gitRef; }
    public Integer     getPrNumber()          { return prNumber; }
    public String      getConcurrencyGroup()  { return concurrencyGroup; }
    public TriggerKind getTriggerKind()       { return triggerKind; }
    public String      getHeadCommitMessage() { return headCommitMessage; }
    public String      getPrTitle()           { return prTitle; }
    public String      getActor()             { return actor; }
    public String      getRepositoryOwner()   { return repositoryOwner; }
    public RunState    getState()             { return state; }
    public JobStatus   getGateStatus()        { return gateStatus; }
    public Instant     getCreatedAt()         { return createdAt; }
    public Instant     getUpdatedAt()         { return updatedAt; }
    public Instant     getFinishedAt()        { return finishedAt; }
    public List<JobRecord> getJobs()          { return jobs; }

    public void setState(RunState state)            { this.state = state; }
    public void setGateStatus(JobStatus gateStatus) { this.gateStatus = gateStatus; }
    public void setFinishedAt(Instant finishedAt)   { this.finishedAt = finishedAt; }

    /** Rebuilds the trigger event this run was created from. */
    public TriggerEvent toTriggerEvent() {
        return new TriggerEvent(triggerKind, workflow, gitRef, headCommitMessage,
                prTitle, prNumber, actor, repositoryOwner);
    }
}
