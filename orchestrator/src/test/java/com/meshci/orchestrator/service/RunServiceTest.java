package com.meshci.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshci.orchestrator.config.MeshCiProperties;
import com.meshci.orchestrator.model.JobRecord;
import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.Run;
import com.meshci.orchestrator.model.RunState;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.pipeline.Criticality;
import com.meshci.orchestrator.pipeline.DagRunner;
import com.meshci.orchestrator.pipeline.JobDefinition;
import com.meshci.orchestrator.pipeline.JobExecution;
import com.meshci.orchestrator.pipeline.JobGraph;
import com.meshci.orchestrator.pipeline.JobStatusListener;
import com.meshci.orchestrator.pipeline.RunCoordinator;
import com.meshci.orchestrator.pipeline.RunHandle;
import com.meshci.orchestrator.pipeline.RunOutcome;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.pipeline.StepOutcome;
import com.meshci.orchestrator.pipeline.StepResult;
import com.meshci.orchestrator.release.ReleaseAdvancer;
import com.meshci.orchestrator.repository.JobRecordRepository;
import com.meshci.orchestrator.repository.RunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RunService.
 *
 * Repositories, the DAG runner and the release advancer are mocked; the
 * concurrency coordinator is the real one.
 */
@ExtendWith(MockitoExtension.class)
class RunServiceTest {

    @Mock RunRepository       runRepo;
    @Mock JobRecordRepository jobRepo;
    @Mock WorkflowCatalog     catalog;
    @Mock DagRunner           dagRunner;
    @Mock ReleaseAdvancer     releaseAdvancer;
    @Mock ExecutorService     runPool;

    RunCoordinator coordinator;
    RunService     service;
    JobGraph       graph;

    @BeforeEach
    void setUp() {
        coordinator = new RunCoordinator();
        service = new RunService(runRepo, jobRepo, catalog, dagRunner, coordinator, releaseAdvancer,
                runPool, new ObjectMapper(), props());
        graph = new JobGraph(List.of(
                job("checks"),
                job("build"),
                job("e2e", "build"),
                JobDefinition.gate("ci", Set.of("checks", "e2e"))));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_savesRunAndPendingJobsThenQueuesExecution() {
        TriggerEvent event = prEvent();
        when(catalog.graph()).thenReturn(graph);
        when(runRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0)));

        Run run = service.submit(event);

        assertThat(run.getState()).isEqualTo(RunState.QUEUED);
        assertThat(run.getConcurrencyGroup()).isEqualTo("pr-checks-pr42");

        ArgumentCaptor<JobRecord> jobs = ArgumentCaptor.forClass(JobRecord.class);
        verify(jobRepo, times(4)).save(jobs.capture());
        assertThat(jobs.getAllValues()).extracting(JobRecord::getName)
                .containsExactly("checks", "build", "e2e", "ci");
        assertThat(jobs.getAllValues()).extracting(JobRecord::getStatus).containsOnly(JobStatus.PENDING);
        assertThat(jobs.getAllValues().get(3).isGate()).isTrue();
        assertThat(jobs.getAllValues().get(2).getDependsOn()).isEqualTo("build");

        verify(runPool).submit(any(Runnable.class));
        assertThat(coordinator.activeRun("pr-checks-pr42")).contains(run.getId());
    }

    // ------------------------------------------------------------------
    // execute()
    // ------------------------------------------------------------------

    @Test
    void execute_gateSucceededOnTrunk_recordsOutcomeAndQueuesRelease() {
        TriggerEvent event = trunkEvent();
        Run run = withId(new Run(event));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(dagRunner.run(eq(graph), eq(run.getId()), eq(event), any(), any()))
                .thenReturn(outcome(JobStatus.SUCCEEDED, false));
        when(releaseAdvancer.eligible(event)).thenReturn(true);

        service.execute(graph, event, handle);

        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(run.getGateStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(run.getFinishedAt()).isNotNull();
        verify(releaseAdvancer).submit(event);
        assertThat(handle.isFinished()).isTrue();
        assertThat(coordinator.activeRun(run.getConcurrencyGroup())).isEmpty();
    }

    @Test
    void execute_predecessorReleasesLate_noJobStartsUntilItDoes() throws Exception {
        RunService patient = new RunService(runRepo, jobRepo, catalog, dagRunner, coordinator, releaseAdvancer,
                runPool, new ObjectMapper(), props(Duration.ofMillis(20)));
        TriggerEvent event = trunkEvent();
        Run run = withId(new Run(event));
        RunHandle previous = coordinator.acquire(run.getConcurrencyGroup(), UUID.randomUUID());
        RunHandle handle   = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(dagRunner.run(any(), any(), any(), any(), any())).thenReturn(outcome(JobStatus.FAILED, false));

        Thread runner = new Thread(() -> patient.execute(graph, event, handle));
        runner.start();
        Thread.sleep(300);

        assertThat(previous.token().isCancelled()).isTrue();
        assertThat(runner.isAlive()).isTrue();
        verify(dagRunner, never()).run(any(), any(), any(), any(), any());
        assertThat(run.getState()).isEqualTo(RunState.QUEUED);

        coordinator.release(previous);
        runner.join(5_000);

        assertThat(runner.isAlive()).isFalse();
        verify(dagRunner).run(eq(graph), eq(run.getId()), eq(event), any(), any());
        assertThat(run.getState()).isEqualTo(RunState.FAILED);
    }

    @Test
    void execute_gateFailed_noRelease() {
        TriggerEvent event = trunkEvent();
        Run run = withId(new Run(event));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(dagRunner.run(any(), any(), any(), any(), any())).thenReturn(outcome(JobStatus.FAILED, false));

        service.execute(graph, event, handle);

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getGateStatus()).isEqualTo(JobStatus.FAILED);
        verify(releaseAdvancer, never()).submit(any());
    }

    @Test
    void execute_cancelled_runCancelled() {
        TriggerEvent event = prEvent();
        Run run = withId(new Run(event));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(dagRunner.run(any(), any(), any(), any(), any())).thenReturn(outcome(JobStatus.CANCELLED, true));

        service.execute(graph, event, handle);

        assertThat(run.getState()).isEqualTo(RunState.CANCELLED);
        verify(releaseAdvancer, never()).submit(any());
    }

    @Test
    void execute_runnerThrows_runFailedAndSlotReleased() {
        TriggerEvent event = prEvent();
        Run run = withId(new Run(event));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(dagRunner.run(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("pool shut down"));

        service.execute(graph, event, handle);

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getGateStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(handle.isFinished()).isTrue();
    }

    @Test
    void execute_listenerPersistsJobTransitionsAndGateStatus() throws Exception {
        TriggerEvent event = prEvent();
        Run run = withId(new Run(event));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        JobRecord e2e  = new JobRecord(run, "e2e", "build", false);
        JobRecord gate = new JobRecord(run, "ci", "checks,e2e", true);
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        when(jobRepo.findByRunIdAndName(run.getId(), "e2e")).thenReturn(Optional.of(e2e));
        when(jobRepo.findByRunIdAndName(run.getId(), "ci")).thenReturn(Optional.of(gate));
        when(dagRunner.run(any(), any(), any(), any(), any())).thenAnswer(inv -> {
            JobStatusListener listener = inv.getArgument(4);
            listener.onStarted("e2e");
            listener.onFinished("e2e", new JobExecution(JobStatus.FAILED, List.of(
                    new StepResult("run e2e", Criticality.FATAL, StepOutcome.FAILED, "exit code 101", 1200),
                    new StepResult("kill all nodes", Criticality.ADVISORY, StepOutcome.SUCCEEDED, null, 40)),
                    "run e2e: exit code 101"));
            listener.onFinished("ci", JobExecution.resolved(JobStatus.FAILED, "dependencies did not succeed: [e2e=FAILED]"));
            return outcome(JobStatus.FAILED, false);
        });

        service.execute(graph, event, handle);

        assertThat(e2e.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(e2e.getStartedAt()).isNotNull();
        assertThat(e2e.getFinishedAt()).isNotNull();
        assertThat(e2e.getFailureReason()).isEqualTo("run e2e: exit code 101");
        assertThat(new ObjectMapper().readTree(e2e.getStepResultsJson()).get(1).get("criticality").asText())
                .isEqualTo("ADVISORY");
        assertThat(gate.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(run.getGateStatus()).isEqualTo(JobStatus.FAILED);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_activeRun_cancelsToken() {
        Run run = withId(new Run(prEvent()));
        RunHandle handle = coordinator.acquire(run.getConcurrencyGroup(), run.getId());
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        assertThat(service.cancel(run.getId())).isTrue();
        assertThat(handle.token().reason()).isEqualTo("cancelled by request");
    }

    @Test
    void cancel_unknownRun_false() {
        UUID id = UUID.randomUUID();
        when(runRepo.findById(id)).thenReturn(Optional.empty());

        assertThat(service.cancel(id)).isFalse();
    }

    // ------------------------------------------------------------------
    // recoverInterruptedRuns()
    // ------------------------------------------------------------------

    @Test
    void recoverInterruptedRuns_closesStaleRunsAsCancelled() {
        Run stale = withId(new Run(prEvent()));
        stale.setState(RunState.RUNNING);
        JobRecord done    = new JobRecord(stale, "checks", "", false);
        done.setStatus(JobStatus.SUCCEEDED);
        JobRecord running = new JobRecord(stale, "e2e", "build", false);
        running.setStatus(JobStatus.RUNNING);
        when(runRepo.findByStateIn(any())).thenReturn(List.of(stale));
        when(jobRepo.findByRunIdOrderByCreatedAtAsc(stale.getId())).thenReturn(List.of(done, running));

        service.recoverInterruptedRuns();

        assertThat(stale.getState()).isEqualTo(RunState.CANCELLED);
        assertThat(done.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(running.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(running.getFailureReason()).isEqualTo("orchestrator restarted");
        verify(jobRepo).save(running);
        verify(jobRepo, never()).save(done);
        verify(runRepo).save(stale);
    }

    @Test
    void recoverInterruptedRuns_runsInOneTransaction() throws Exception {
        assertThat(RunService.class.getMethod("recoverInterruptedRuns").isAnnotationPresent(Transactional.class))
                .isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RunOutcome outcome(JobStatus gate, boolean cancelled) {
        Map<String, JobStatus> statuses = new LinkedHashMap<>();
        for (String name : graph.topologicalOrder()) {
            statuses.put(name, name.equals("ci") ? gate : JobStatus.SUCCEEDED);
        }
        return new RunOutcome(statuses, "ci", cancelled);
    }

    private static JobDefinition job(String name, String... needs) {
        return JobDefinition.job(name, Set.of(needs),
                List.of(StepDefinition.fatal("noop", Duration.ofSeconds(1), ctx -> { })));
    }

    private static TriggerEvent prEvent() {
        return TriggerEvent.pullRequest("pr-checks", 42, "feat: churn", "alice", "maidsafe");
    }

    private static TriggerEvent trunkEvent() {
        return TriggerEvent.push("merge", "refs/heads/main", "feat: churn (#42)", "alice", "maidsafe");
    }

    private static Run withId(Run run) {
        try {
            var f = Run.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }

    private static MeshCiProperties props() {
        return props(Duration.ofSeconds(1));
    }

    private static MeshCiProperties props(Duration predecessorWait) {
        return new MeshCiProperties("ci", predecessorWait, null, null, null, "/tmp/meshci", null, null,
                null, List.of(), null,
                new MeshCiProperties.Release(true, "main", "maidsafe", "chore(release):", "/tmp/repo",
                        List.of(), "v", "origin", "", "bot", "bot@example.org", Duration.ofMinutes(1)));
    }
}
