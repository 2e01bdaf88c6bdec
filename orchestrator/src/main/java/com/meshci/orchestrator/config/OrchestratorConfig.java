package com.meshci.orchestrator.config;

import com.meshci.orchestrator.artifact.ArtifactStore;
import com.meshci.orchestrator.artifact.FileSystemArtifactStore;
import com.meshci.orchestrator.artifact.HttpArtifactStore;
import com.meshci.orchestrator.build.BinaryTarget;
import com.meshci.orchestrator.build.BuildPipeline;
import com.meshci.orchestrator.build.BuildSettings;
import com.meshci.orchestrator.diagnostics.DiagnosticsCapture;
import com.meshci.orchestrator.diagnostics.DiagnosticsSettings;
import com.meshci.orchestrator.harness.HarnessSettings;
import com.meshci.orchestrator.harness.TestHarness;
import com.meshci.orchestrator.network.ConvergencePoller;
import com.meshci.orchestrator.network.MembershipLog;
import com.meshci.orchestrator.network.NetworkBootstrapper;
import com.meshci.orchestrator.network.NetworkSettings;
import com.meshci.orchestrator.network.Poller;
import com.meshci.orchestrator.network.Sleeper;
import com.meshci.orchestrator.pipeline.DagRunner;
import com.meshci.orchestrator.pipeline.JobExecutor;
import com.meshci.orchestrator.pipeline.RunCoordinator;
import com.meshci.orchestrator.pipeline.TriggerFilter;
import com.meshci.orchestrator.process.ProcessRunner;
import com.meshci.orchestrator.release.GitClient;
import com.meshci.orchestrator.release.ReleaseAdvancer;
import com.meshci.orchestrator.release.ReleaseSettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the orchestration engine from {@link MeshCiProperties}.
 *
 * Three bounded pools:
 * <pre>
 *   runPool   one thread per executing Run (coordinates its DAG)
 *   jobPool   one thread per running Job
 *   stepPool  one thread per running Step (so step timeouts can be enforced)
 * </pre>
 * plus a single-threaded release queue.
 */
@Configuration
@EnableConfigurationProperties(MeshCiProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    // ------------------------------------------------------------------
    // Pools
    // ------------------------------------------------------------------

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runPool(MeshCiProperties props) {
        return Executors.newFixedThreadPool(props.pools().runThreads(), named("meshci-run-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobPool(MeshCiProperties props) {
        return Executors.newFixedThreadPool(props.pools().jobThreads(), named("meshci-job-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stepPool(MeshCiProperties props) {
        return Executors.newFixedThreadPool(props.pools().stepThreads(), named("meshci-step-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService releaseQueue() {
        return Executors.newSingleThreadExecutor(named("meshci-release-"));
    }

    // ------------------------------------------------------------------
    // Infrastructure
    // ------------------------------------------------------------------

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public ArtifactStore artifactStore(MeshCiProperties props) {
        MeshCiProperties.Artifacts artifacts = props.artifacts();
        if ("http".equalsIgnoreCase(artifacts.backend())) {
            log.info("Artifact store: http at {}", artifacts.baseUrl());
            return new HttpArtifactStore(artifacts.baseUrl(), artifacts.token(), artifacts.requestTimeout());
        }
        if (!"filesystem".equalsIgnoreCase(artifacts.backend())) {
            throw new IllegalStateException("Unknown artifact backend: " + artifacts.backend());
        }
        log.info("Artifact store: filesystem at {}", artifacts.root());
        return new FileSystemArtifactStore(Path.of(artifacts.root()));
    }

    // ------------------------------------------------------------------
    // Build, network, harness
    // ------------------------------------------------------------------

    @Bean
    public BuildSettings buildSettings(MeshCiProperties props) {
        MeshCiProperties.Build build = props.build();
        List<BinaryTarget> binaries = build.binaries().stream()
                .map(b -> new BinaryTarget(b.name(), b.command()))
                .toList();
        return new BuildSettings(Path.of(props.workspace()), build.targetTriple(), binaries, build.timeout());
    }

    @Bean
    public BuildPipeline buildPipeline(ProcessRunner processRunner, ArtifactStore artifactStore) {
        return new BuildPipeline(processRunner, artifactStore);
    }

    @Bean
    public NetworkSettings networkSettings(MeshCiProperties props) {
        MeshCiProperties.Network n = props.network();
        return new NetworkSettings(n.nodeCount(), n.joinInterval(), n.pollInterval(), n.convergenceCeiling(),
                Path.of(n.workRoot()), n.nodeBinary(), n.bootstrapBinary(), n.logFilter(), n.nodeArgs());
    }

    @Bean
    public Poller poller(Clock clock) {
        return new Poller(clock, Sleeper.SYSTEM);
    }

    @Bean
    public MembershipLog membershipLog(MeshCiProperties props) {
        return new MembershipLog(props.network().joinPattern(), props.network().leavePattern());
    }

    @Bean
    public ConvergencePoller convergencePoller(Poller poller, MembershipLog membershipLog) {
        return new ConvergencePoller(poller, membershipLog);
    }

    @Bean
    public NetworkBootstrapper networkBootstrapper(ArtifactStore artifactStore, ProcessRunner processRunner) {
        return new NetworkBootstrapper(artifactStore, processRunner);
    }

    @Bean
    public DiagnosticsCapture diagnosticsCapture(MeshCiProperties props,
                                                 ProcessRunner processRunner,
                                                 ArtifactStore artifactStore) {
        DiagnosticsSettings settings = new DiagnosticsSettings(props.diagnostics().timelineCommand(),
                Path.of(props.workspace()), props.diagnostics().timeout());
        return new DiagnosticsCapture(processRunner, artifactStore, settings);
    }

    @Bean
    public TestHarness testHarness(MeshCiProperties props,
                                   NetworkBootstrapper bootstrapper,
                                   ConvergencePoller convergencePoller,
                                   MembershipLog membershipLog,
                                   ProcessRunner processRunner,
                                   DiagnosticsCapture diagnosticsCapture,
                                   NetworkSettings networkSettings,
                                   @Qualifier("stepPool") ExecutorService stepPool) {
        MeshCiProperties.Harness harness = props.harness();
        HarnessSettings settings = new HarnessSettings(Path.of(props.workspace()),
                harness.startTimeout(), harness.checkTimeout());
        return new TestHarness(bootstrapper, convergencePoller, membershipLog, processRunner,
                diagnosticsCapture, Sleeper.SYSTEM, networkSettings, settings, stepPool);
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    @Bean
    public JobExecutor jobExecutor(@Qualifier("stepPool") ExecutorService stepPool, MeterRegistry meterRegistry) {
        return new JobExecutor(stepPool, meterRegistry);
    }

    @Bean
    public TriggerFilter triggerFilter(MeshCiProperties props) {
        return new TriggerFilter(List.of(props.trigger().releaseCommitMarker()),
                                 List.of(props.trigger().releasePrTitleMarker()));
    }

    @Bean
    public DagRunner dagRunner(@Qualifier("jobPool") ExecutorService jobPool,
                               JobExecutor jobExecutor,
                               TriggerFilter triggerFilter) {
        return new DagRunner(jobPool, jobExecutor, triggerFilter);
    }

    @Bean
    public RunCoordinator runCoordinator() {
        return new RunCoordinator();
    }

    // ------------------------------------------------------------------
    // Release
    // ------------------------------------------------------------------

    @Bean
    public ReleaseSettings releaseSettings(MeshCiProperties props) {
        MeshCiProperties.Release r = props.release();
        return new ReleaseSettings(r.trunk(), r.owner(), r.commitMarker(), Path.of(r.repoDir()),
                r.manifests(), r.tagPrefix(), r.remote(), r.token());
    }

    @Bean
    public ReleaseAdvancer releaseAdvancer(MeshCiProperties props,
                                           ReleaseSettings settings,
                                           ProcessRunner processRunner,
                                           @Qualifier("releaseQueue") ExecutorService releaseQueue,
                                           MeterRegistry meterRegistry) {
        MeshCiProperties.Release r = props.release();
        GitClient git = new GitClient(processRunner, settings.repoDir(), r.gitTimeout(),
                r.authorName(), r.authorEmail());
        return new ReleaseAdvancer(git, settings, releaseQueue, meterRegistry);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
