package com.meshci.orchestrator.harness;

import com.meshci.orchestrator.diagnostics.DiagnosticsCapture;
import com.meshci.orchestrator.diagnostics.DiagnosticsMode;
import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.network.ConvergencePoller;
import com.meshci.orchestrator.network.ConvergenceTimeoutException;
import com.meshci.orchestrator.network.LogLine;
import com.meshci.orchestrator.network.LogSource;
import com.meshci.orchestrator.network.MembershipLog;
import com.meshci.orchestrator.network.MembershipSnapshot;
import com.meshci.orchestrator.network.NetworkBootstrapper;
import com.meshci.orchestrator.network.NetworkInstance;
import com.meshci.orchestrator.network.NetworkSettings;
import com.meshci.orchestrator.pipeline.CancellationToken;
import com.meshci.orchestrator.pipeline.Criticality;
import com.meshci.orchestrator.pipeline.JobContext;
import com.meshci.orchestrator.pipeline.JobDefinition;
import com.meshci.orchestrator.pipeline.JobExecution;
import com.meshci.orchestrator.pipeline.JobExecutor;
import com.meshci.orchestrator.pipeline.RunCondition;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.pipeline.StepOutcome;
import com.meshci.orchestrator.pipeline.StepResult;
import com.meshci.orchestrator.process.CommandResult;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TestHarnessTest {

    private static final Path WORKSPACE = Path.of("/work/safe_network");

    @Mock NetworkBootstrapper bootstrapper;
    @Mock ConvergencePoller   convergencePoller;
    @Mock ProcessRunner       processRunner;
    @Mock DiagnosticsCapture  diagnostics;
    @Mock NetworkInstance     instance;

    List<Duration>  sleeps;
    TestHarness     harness;
    ExecutorService stepPool;

    @BeforeEach
    void setUp() {
        sleeps = new CopyOnWriteArrayList<>();
        stepPool = Executors.newCachedThreadPool();
        harness = new TestHarness(bootstrapper, convergencePoller,
                new MembershipLog(MembershipLog.DEFAULT_JOIN_PATTERN, MembershipLog.DEFAULT_LEAVE_PATTERN),
                processRunner, diagnostics, sleeps::add, network(),
                new HarnessSettings(WORKSPACE, Duration.ofMinutes(5), Duration.ofMinutes(2)), stepPool);
    }

    @AfterEach
    void tearDown() {
        stepPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Job layout
    // ------------------------------------------------------------------

    @Test
    void job_standard_stepOrderAndCriticality() {
        when(diagnostics.steps("e2e", "ubuntu-latest", DiagnosticsMode.ON_FAILURE)).thenReturn(diagnosticSteps());

        JobDefinition job = harness.job(spec(false, suite("e2e"), suite("api")));

        assertThat(job.needs()).containsExactly("build");
        assertThat(job.steps()).extracting(StepDefinition::name).containsExactly(
                "start network",
                "wait for nodes to join",
                "run e2e",
                "run api",
                "ensure no nodes left",
                "count live nodes",
                "kill all nodes",
                "generate timeline");
        assertThat(step(job, "ensure no nodes left").criticality()).isEqualTo(Criticality.ADVISORY);
        assertThat(step(job, "kill all nodes").condition()).isEqualTo(RunCondition.ALWAYS);
        assertThat(step(job, "count live nodes").condition()).isEqualTo(RunCondition.ALWAYS);
        assertThat(step(job, "run e2e").criticality()).isEqualTo(Criticality.FATAL);
    }

    @Test
    void job_churn_addsNodesAroundSuitesAndMakesDepartureCheckFatal() {
        when(diagnostics.steps("e2e", "ubuntu-latest", DiagnosticsMode.ON_FAILURE)).thenReturn(diagnosticSteps());

        JobDefinition job = harness.job(spec(true, suite("churn")));

        assertThat(job.steps()).extracting(StepDefinition::name).containsSubsequence(
                "wait for nodes to join", "start adding 12 nodes", "run churn", "finish adding nodes",
                "wait for added nodes to join", "ensure no nodes left");
        assertThat(step(job, "ensure no nodes left").criticality()).isEqualTo(Criticality.FATAL);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Test
    void execute_churnWithDeparture_jobFailsAndNodesAreStillKilled() {
        when(diagnostics.steps(any(), any(), any())).thenReturn(List.of());
        when(bootstrapper.launch(any(), eq("e2e-churn"), any())).thenReturn(instance);
        when(convergencePoller.awaitConvergence(instance, 15)).thenReturn(snapshot(15));
        when(convergencePoller.awaitConvergence(instance, 27)).thenReturn(snapshot(27));
        when(instance.environment()).thenReturn(Map.of("HOME", "/tmp/meshci/run/e2e-churn"));
        when(processRunner.run(any())).thenReturn(new CommandResult(0, "test result: ok", false, 1000));
        when(instance.logSource()).thenReturn(logs(
                new LogLine("sn-node-3", "Membership - decided: Joined(sn-node-3)"),
                new LogLine("sn-node-7", "Membership - decided: Left(sn-node-7)")));

        JobExecution result = execute(harness.job(spec(true, suite("churn"))));

        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.failureReason()).startsWith("ensure no nodes left:").contains("sn-node-7");
        assertThat(outcome(result, "start adding 12 nodes")).isEqualTo(StepOutcome.SUCCEEDED);
        assertThat(outcome(result, "finish adding nodes")).isEqualTo(StepOutcome.SUCCEEDED);
        assertThat(outcome(result, "kill all nodes")).isEqualTo(StepOutcome.SUCCEEDED);
        verify(instance).addNode(1);
        verify(instance).addNode(12);
        verify(instance).teardown();
        assertThat(sleeps).hasSize(11).containsOnly(Duration.ofSeconds(30));
    }

    @Test
    void execute_churn_extraNodesJoinWhileSuiteIsRunning() {
        when(diagnostics.steps(any(), any(), any())).thenReturn(List.of());
        when(bootstrapper.launch(any(), eq("e2e-churn"), any())).thenReturn(instance);
        when(convergencePoller.awaitConvergence(instance, 15)).thenReturn(snapshot(15));
        when(convergencePoller.awaitConvergence(instance, 27)).thenReturn(snapshot(27));
        when(instance.environment()).thenReturn(Map.of());
        when(instance.logSource()).thenReturn(logs(
                new LogLine("sn-node-1", "Membership - decided: Joined(sn-node-20)")));

        CountDownLatch added = new CountDownLatch(12);
        doAnswer(inv -> {
            added.countDown();
            return null;
        }).when(instance).addNode(anyInt());
        AtomicLong addedDuringSuite = new AtomicLong(-1);
        when(processRunner.run(any())).thenAnswer(inv -> {
            added.await(10, TimeUnit.SECONDS);
            addedDuringSuite.set(12 - added.getCount());
            return new CommandResult(0, "test result: ok", false, 1000);
        });

        JobExecution result = execute(harness.job(spec(true, suite("churn"))));

        assertThat(result.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(addedDuringSuite.get()).isEqualTo(12);
        verify(convergencePoller).awaitConvergence(instance, 27);
    }

    @Test
    void execute_churnSuiteFails_pendingLaunchesCancelled() throws Exception {
        when(diagnostics.steps(any(), any(), any())).thenReturn(List.of());
        when(bootstrapper.launch(any(), eq("e2e-churn"), any())).thenReturn(instance);
        when(convergencePoller.awaitConvergence(instance, 15)).thenReturn(snapshot(15));
        when(instance.environment()).thenReturn(Map.of());
        when(instance.logSource()).thenReturn(logs());
        CountDownLatch sleeping    = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(processRunner.run(any())).thenAnswer(inv -> {
            sleeping.await(10, TimeUnit.SECONDS);
            return new CommandResult(101, "churn FAILED", false, 1000);
        });
        TestHarness slowChurn = new TestHarness(bootstrapper, convergencePoller,
                new MembershipLog(MembershipLog.DEFAULT_JOIN_PATTERN, MembershipLog.DEFAULT_LEAVE_PATTERN),
                processRunner, diagnostics, d -> {
                    sleeping.countDown();
                    try {
                        Thread.sleep(60_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                }, network(), new HarnessSettings(WORKSPACE, Duration.ofMinutes(5), Duration.ofMinutes(2)), stepPool);

        JobExecution result = execute(slowChurn.job(spec(true, suite("churn"))));

        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.failureReason()).startsWith("run churn:");
        assertThat(outcome(result, "finish adding nodes")).isEqualTo(StepOutcome.SKIPPED);
        assertThat(outcome(result, "kill all nodes")).isEqualTo(StepOutcome.SUCCEEDED);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        verify(instance, never()).addNode(2);
        verify(convergencePoller, never()).awaitConvergence(instance, 27);
        verify(instance).teardown();
    }

    @Test
    void execute_networkNeverConverges_suitesSkippedTeardownStillRuns() {
        when(diagnostics.steps(any(), any(), any())).thenReturn(List.of());
        when(bootstrapper.launch(any(), any(), any())).thenReturn(instance);
        when(convergencePoller.awaitConvergence(instance, 15))
                .thenThrow(new ConvergenceTimeoutException(15, 14, Duration.ofMinutes(5)));
        when(instance.logSource()).thenReturn(logs());

        JobExecution result = execute(harness.job(spec(false, suite("e2e"))));

        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.failureReason()).contains("14/15");
        assertThat(outcome(result, "run e2e")).isEqualTo(StepOutcome.SKIPPED);
        assertThat(outcome(result, "ensure no nodes left")).isEqualTo(StepOutcome.SKIPPED);
        verify(processRunner, never()).run(any());
        verify(instance).teardown();
    }

    @Test
    void execute_bootstrapFails_teardownSkipsMissingInstance() {
        when(diagnostics.steps(any(), any(), any())).thenReturn(List.of());
        when(bootstrapper.launch(any(), any(), any()))
                .thenThrow(new IllegalStateException("Build archive not found"));

        JobExecution result = execute(harness.job(spec(false, suite("e2e"))));

        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(outcome(result, "kill all nodes")).isEqualTo(StepOutcome.SUCCEEDED);
        assertThat(outcome(result, "count live nodes")).isEqualTo(StepOutcome.FAILED);
        verify(convergencePoller, never()).awaitConvergence(any(NetworkInstance.class), anyInt());
    }

    // ------------------------------------------------------------------
    // Step bodies
    // ------------------------------------------------------------------

    @Test
    void runSuite_runsAgainstInstanceEnvironment() {
        when(instance.environment()).thenReturn(Map.of("HOME", "/tmp/meshci/run/e2e"));
        when(processRunner.run(any())).thenReturn(new CommandResult(0, "ok", false, 10));

        harness.runSuite(new TestSuite("api", List.of("cargo", "test", "-p", "sn_api"),
                Duration.ofMinutes(30), "sn_client=trace", Map.of("RUST_BACKTRACE", "1")), instance);

        ArgumentCaptor<CommandSpec> spec = ArgumentCaptor.forClass(CommandSpec.class);
        verify(processRunner).run(spec.capture());
        assertThat(spec.getValue().workingDir()).isEqualTo(WORKSPACE);
        assertThat(spec.getValue().env())
                .containsEntry("HOME", "/tmp/meshci/run/e2e")
                .containsEntry("RUST_LOG", "sn_client=trace")
                .containsEntry("RUST_BACKTRACE", "1");
        assertThat(spec.getValue().timeout()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void runSuite_nonZeroExit_throwsSuiteFailed() {
        when(instance.environment()).thenReturn(Map.of());
        when(processRunner.run(any())).thenReturn(new CommandResult(101, "test put_get ... FAILED", false, 10));

        assertThatThrownBy(() -> harness.runSuite(suite("e2e"), instance))
                .isInstanceOfSatisfying(SuiteFailedException.class, e -> {
                    assertThat(e.suite()).isEqualTo("e2e");
                    assertThat(e.getMessage()).contains("exit code 101").contains("put_get");
                });
    }

    @Test
    void runSuite_timeout_throwsSuiteFailed() {
        when(instance.environment()).thenReturn(Map.of());
        when(processRunner.run(any())).thenReturn(new CommandResult(-1, "", true, 1_800_000));

        assertThatThrownBy(() -> harness.runSuite(suite("e2e"), instance))
                .isInstanceOf(SuiteFailedException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void addNodes_staggersByJoinInterval() throws Exception {
        harness.addNodes(instance, 3);

        verify(instance).addNode(1);
        verify(instance).addNode(2);
        verify(instance).addNode(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobExecution execute(JobDefinition job) {
        JobContext ctx = new JobContext(UUID.randomUUID(),
                TriggerEvent.pullRequest("pr-checks", 42, "feat: churn", "alice", "maidsafe"),
                job.name(), new CancellationToken());
        return new JobExecutor(stepPool, new SimpleMeterRegistry()).execute(job, ctx);
    }

    private static NetworkSettings network() {
        return new NetworkSettings(15, Duration.ofSeconds(30), Duration.ofSeconds(5),
                Duration.ofMinutes(5), Path.of("/tmp/meshci"), "sn_node", "testnet", "safe_network=trace",
                List.of("--root-dir", "{nodeDir}"));
    }

    private static HarnessJobSpec spec(boolean churn, TestSuite... suites) {
        return new HarnessJobSpec(churn ? "e2e-churn" : "e2e", "e2e", Set.of("build"), List.of(suites),
                churn, 12, "ubuntu-latest", DiagnosticsMode.ON_FAILURE);
    }

    private static TestSuite suite(String name) {
        return new TestSuite(name, List.of("cargo", "test", "--release", "--test", name),
                Duration.ofMinutes(30), null, Map.of());
    }

    private static List<StepDefinition> diagnosticSteps() {
        return List.of(StepDefinition.advisory("generate timeline", Duration.ofMinutes(1), ctx -> { })
                .when(RunCondition.ON_FAILURE));
    }

    private static StepDefinition step(JobDefinition job, String name) {
        return job.steps().stream().filter(s -> s.name().equals(name)).findFirst().orElseThrow();
    }

    private static StepOutcome outcome(JobExecution execution, String step) {
        return execution.steps().stream().filter(r -> r.step().equals(step))
                .map(StepResult::outcome).findFirst().orElseThrow();
    }

    private static MembershipSnapshot snapshot(int joined) {
        List<String> nodes = new ArrayList<>();
        for (int i = 1; i <= joined; i++) nodes.add("sn-node-" + i);
        return new MembershipSnapshot(Set.copyOf(nodes), List.of());
    }

    private static LogSource logs(LogLine... lines) {
        return new LogSource() {
            @Override public Path root() { return Path.of("/tmp/meshci/logs"); }
            @Override public List<Path> files() { return List.of(); }
            @Override public List<LogLine> lines() { return List.of(lines); }
        };
    }
}
