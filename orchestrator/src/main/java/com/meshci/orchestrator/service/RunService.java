package com.meshci.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshci.orchestrator.config.MeshCiProperties;
import com.meshci.orchestrator.model.JobRecord;
import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.Run;
import com.meshci.orchestrator.model.RunState;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.pipeline.DagRunner;
import com.meshci.orchestrator.pipeline.JobExecution;
import com.meshci.orchestrator.pipeline.JobGraph;
import com.meshci.orchestrator.pipeline.JobStatusListener;
import com.meshci.orchestrator.pipeline.RunCoordinator;
import com.meshci.orchestrator.pipeline.RunHandle;
import com.meshci.orchestrator.pipeline.RunOutcome;
import com.meshci.orchestrator.release.ReleaseAdvancer;
import com.meshci.orchestrator.repository.JobRecordRepository;
import com.meshci.orchestrator.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Run lifecycle: submission, asynchronous execution, persistence of job
 * status changes, cancellation and recovery after a restart.
 *
 * Submission is synchronous up to the point where the Run and its job rows
 * exist and the Run holds its concurrency slot; the DAG itself runs on the
 * run pool.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final RunRepository       runRepo;
    private final JobRecordRepository jobRepo;
    private final WorkflowCatalog     catalog;
    private final DagRunner           dagRunner;
    private final RunCoordinator      coordinator;
    private final ReleaseAdvancer     releaseAdvancer;
    private final ExecutorService     runPool;
    private final ObjectMapper        objectMapper;
    private final Duration            predecessorWait;
    private final boolean             releaseEnabled;

    public RunService(RunRepository runRepo,
                      JobRecordRepository jobRepo,
                      WorkflowCatalog catalog,
                      DagRunner dagRunner,
                      RunCoordinator coordinator,
                      ReleaseAdvancer releaseAdvancer,
                      @Qualifier("runPool") ExecutorService runPool,
                      ObjectMapper objectMapper,
                      MeshCiProperties props) {
        this.runRepo         = runRepo;
        this.jobRepo         = jobRepo;
        this.catalog         = catalog;
        this.dagRunner       = dagRunner;
        this.coordinator     = coordinator;
        this.releaseAdvancer = releaseAdvancer;
        this.runPool         = runPool;
        this.objectMapper    = objectMapper;
        this.predecessorWait = props.predecessorWait();
        this.releaseEnabled  = props.release() != null && props.release().enabled();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Create a Run for the event and start it.
     *
     * Steps:
     *  1. Save the Run (QUEUED) and one PENDING row per job
     *  2. Take the concurrency slot, cancelling the group's previous Run
     *  3. Hand the Run to the run pool
     */
    public Run submit(TriggerEvent event) {
        JobGraph graph = catalog.graph();
        Run run = runRepo.save(new Run(event));
        for (String name : graph.topologicalOrder()) {
            jobRepo.save(new JobRecord(run, name,
                    String.join(",", graph.job(name).needs()), graph.job(name).gate()));
        }

        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        log.info("Run {} queued for {} on {} (group {})",
                run.getId(), event.workflow(), event.ref(), run.getConcurrencyGroup());
        runPool.submit(() -> execute(graph, event, handle));
        return run;
    }

    public Optional<Run> findById(UUID id) {
        return runRepo.findById(id);
    }

    public List<JobRecord> getJobs(UUID runId) {
        return jobRepo.findByRunIdOrderByCreatedAtAsc(runId);
    }

    public String gateName() {
        return catalog.graph().gateName();
    }

    /**
     * Request cancellation of a Run. A Run that already finished is left alone.
     *
     * @return false if no Run with this id exists
     */
    public boolean cancel(UUID runId) {
        Optional<Run> run = runRepo.findById(runId);
        if (run.isEmpty()) {
            return false;
        }
        if (coordinator.cancel(runId, "cancelled by request")) {
            log.info("Run {} cancellation requested", runId);
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Execution (run pool)
    // ------------------------------------------------------------------

    void execute(JobGraph graph, TriggerEvent event, RunHandle handle) {
        UUID runId = handle.runId();
        MDC.put("runId", runId.toString());
        try {
            try {
                awaitPredecessor(handle);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.token().cancel("interrupted before start");
            }

            updateRun(runId, run -> run.setState(RunState.RUNNING));
            RunOutcome outcome = dagRunner.run(graph, runId, event, handle.token(), new PersistingListener(runId));

            updateRun(runId, run -> {
                run.setState(outcome.runState());
                run.setGateStatus(outcome.gateStatus());
                run.setFinishedAt(Instant.now());
            });
            log.info("Run {} {}", runId, outcome.runState());

            if (outcome.runState() == RunState.SUCCEEDED && releaseEnabled && releaseAdvancer.eligible(event)) {
                log.info("Run {} succeeded on trunk, queueing release", runId);
                releaseAdvancer.submit(event);
            }
        } catch (RuntimeException e) {
            log.error("Unhandled error executing run {}: {}", runId, e.getMessage(), e);
            updateRun(runId, run -> {
                run.setState(RunState.FAILED);
                run.setGateStatus(JobStatus.FAILED);
                run.setFinishedAt(Instant.now());
            });
        } finally {
            coordinator.release(handle);
            MDC.remove("runId");
        }
    }

    /**
     * Jobs of this Run never start while the Run it superseded still holds
     * the group. Cancelled Runs only finish their bounded ALWAYS steps, so
     * the wait has no deadline; it is reported every {@code predecessorWait}.
     */
    private void awaitPredecessor(RunHandle handle) throws InterruptedException {
        while (!handle.awaitPredecessor(predecessorWait)) {
            log.warn("Superseded run of group '{}' still winding down; waiting another {}",
                    handle.group(), predecessorWait);
        }
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Runs that were queued or running when the orchestrator stopped have
     * lost their processes; close them as CANCELLED.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void recoverInterruptedRuns() {
        List<Run> stale = runRepo.findByStateIn(EnumSet.of(RunState.QUEUED, RunState.RUNNING));
        for (Run run : stale) {
            for (JobRecord job : jobRepo.findByRunIdOrderByCreatedAtAsc(run.getId())) {
                if (!job.getStatus().isTerminal()) {
                    job.setStatus(JobStatus.CANCELLED);
                    job.setFailureReason("orchestrator restarted");
                    job.setFinishedAt(Instant.now());
                    jobRepo.save(job);
                }
            }
            run.setState(RunState.CANCELLED);
            run.setFinishedAt(Instant.now());
            runRepo.save(run);
        }
        if (!stale.isEmpty()) {
            log.warn("Cancelled {} runs interrupted by a restart", stale.size());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void updateRun(UUID runId, Consumer<Run> change) {
        runRepo.findById(runId).ifPresent(run -> {
            change.accept(run);
            runRepo.save(run);
        });
    }

    private String toJson(JobExecution execution) {
        try {
            return objectMapper.writeValueAsString(execution.steps());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise step results: {}", e.getMessage());
            return null;
        }
    }

    /** Mirrors job transitions into run_jobs, and the gate's into runs.gate_status. */
    private class PersistingListener implements JobStatusListener {

        private final UUID runId;

        PersistingListener(UUID runId) {
            this.runId = runId;
        }

        @Override
        public void onStarted(String job) {
            jobRepo.findByRunIdAndName(runId, job).ifPresent(record -> {
                record.setStatus(JobStatus.RUNNING);
                record.setStartedAt(Instant.now());
                jobRepo.save(record);
            });
        }

        @Override
        public void onFinished(String job, JobExecution execution) {
            jobRepo.findByRunIdAndName(runId, job).ifPresent(record -> {
                record.setStatus(execution.status());
                record.setFailureReason(execution.failureReason());
                record.setStepResultsJson(toJson(execution));
                record.setFinishedAt(Instant.now());
                jobRepo.save(record);
                if (record.isGate()) {
                    updateRun(runId, run -> run.setGateStatus(execution.status()));
                }
            });
        }
    }
}
