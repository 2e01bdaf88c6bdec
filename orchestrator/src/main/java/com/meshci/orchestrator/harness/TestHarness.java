package com.meshci.orchestrator.harness;

import com.meshci.orchestrator.diagnostics.DiagnosticsCapture;
import com.meshci.orchestrator.network.ConvergencePoller;
import com.meshci.orchestrator.network.MembershipLog;
import com.meshci.orchestrator.network.MembershipSnapshot;
import com.meshci.orchestrator.network.NetworkBootstrapper;
import com.meshci.orchestrator.network.NetworkInstance;
import com.meshci.orchestrator.network.NetworkSettings;
import com.meshci.orchestrator.network.Sleeper;
import com.meshci.orchestrator.pipeline.JobContext;
import com.meshci.orchestrator.pipeline.JobDefinition;
import com.meshci.orchestrator.pipeline.RunCondition;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.process.CommandResult;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns a {@link HarnessJobSpec} into a job:
 * <pre>
 *   start network → wait for N joins → suites → no departures
 *   → count live nodes → kill all nodes → diagnostics
 * </pre>
 * A churn job starts adding its extra nodes in the background before the
 * suites and, once they pass, waits for the launches to finish and for
 * N+extra joins, so membership changes while the suites are running.
 * The last three groups run after failures too; the departure check is
 * FATAL for churn jobs and informational otherwise.
 */
public class TestHarness {

    private static final Logger log = LoggerFactory.getLogger(TestHarness.class);

    private static final Duration SLACK = Duration.ofMinutes(1);

    /** JobContext attribute holding the background node launches of a churn job. */
    static final String CHURN_KEY = "churn";

    private final NetworkBootstrapper bootstrapper;
    private final ConvergencePoller   convergencePoller;
    private final MembershipLog       membershipLog;
    private final ProcessRunner       processRunner;
    private final DiagnosticsCapture  diagnostics;
    private final Sleeper             sleeper;
    private final NetworkSettings     network;
    private final HarnessSettings     settings;
    private final ExecutorService     churnPool;

    public TestHarness(NetworkBootstrapper bootstrapper,
                       ConvergencePoller convergencePoller,
                       MembershipLog membershipLog,
                       ProcessRunner processRunner,
                       DiagnosticsCapture diagnostics,
                       Sleeper sleeper,
                       NetworkSettings network,
                       HarnessSettings settings,
                       ExecutorService churnPool) {
        this.bootstrapper      = bootstrapper;
        this.convergencePoller = convergencePoller;
        this.membershipLog     = membershipLog;
        this.processRunner     = processRunner;
        this.diagnostics       = diagnostics;
        this.sleeper           = sleeper;
        this.network           = network;
        this.settings          = settings;
        this.churnPool         = churnPool;
    }

    public JobDefinition job(HarnessJobSpec spec) {
        List<StepDefinition> steps = new ArrayList<>();
        int nodeCount = network.nodeCount();

        steps.add(StepDefinition.fatal("start network", settings.startTimeout(), ctx -> {
            NetworkInstance instance = bootstrapper.launch(ctx.runId(), spec.jobName(), network);
            ctx.put(NetworkInstance.CONTEXT_KEY, instance);
        }));
        steps.add(StepDefinition.fatal("wait for nodes to join", network.convergenceCeiling().plus(SLACK),
                ctx -> convergencePoller.awaitConvergence(instance(ctx), nodeCount)));

        if (spec.churn()) {
            steps.add(StepDefinition.fatal("start adding " + spec.extraNodes() + " nodes", settings.checkTimeout(),
                    ctx -> ctx.put(CHURN_KEY, churnPool.submit(() -> {
                        addNodes(instance(ctx), spec.extraNodes());
                        return null;
                    }))));
        }

        for (TestSuite suite : spec.suites()) {
            steps.add(StepDefinition.fatal("run " + suite.name(), suite.timeout().plus(SLACK),
                    ctx -> runSuite(suite, instance(ctx))));
        }

        if (spec.churn()) {
            Duration staggering = network.joinInterval().multipliedBy(spec.extraNodes());
            steps.add(StepDefinition.fatal("finish adding nodes", staggering.plus(SLACK), this::awaitChurn));
            steps.add(StepDefinition.fatal("wait for added nodes to join", network.convergenceCeiling().plus(SLACK),
                    ctx -> convergencePoller.awaitConvergence(instance(ctx), nodeCount + spec.extraNodes())));
        }

        StepDefinition departures = spec.churn()
                ? StepDefinition.fatal("ensure no nodes left", settings.checkTimeout(), this::checkNoDepartures)
                : StepDefinition.advisory("ensure no nodes left", settings.checkTimeout(), this::checkNoDepartures);
        steps.add(departures);

        steps.add(StepDefinition.advisory("count live nodes", settings.checkTimeout(), ctx -> {
            NetworkInstance instance = instance(ctx);
            log.info("{} nodes still running, {} log files", instance.aliveNodeCount(),
                    instance.logSource().files().size());
        }).when(RunCondition.ALWAYS));
        steps.add(StepDefinition.advisory("kill all nodes", settings.checkTimeout(), ctx -> {
            ctx.get(CHURN_KEY, Future.class).ifPresent(churn -> churn.cancel(true));
            ctx.get(NetworkInstance.CONTEXT_KEY, NetworkInstance.class).ifPresent(NetworkInstance::teardown);
        }).when(RunCondition.ALWAYS));

        steps.addAll(diagnostics.steps(spec.label(), spec.platform(), spec.diagnostics()));

        return JobDefinition.job(spec.jobName(), spec.needs(), steps);
    }

    // ------------------------------------------------------------------
    // Step bodies
    // ------------------------------------------------------------------

    void runSuite(TestSuite suite, NetworkInstance instance) {
        log.info("Running suite '{}'", suite.name());
        CommandSpec command = CommandSpec.of(suite.command())
                .in(settings.workspace())
                .withEnv(instance.environment())
                .withEnv(suite.env())
                .withTimeout(suite.timeout());
        if (suite.logFilter() != null) {
            command = command.withEnv("RUST_LOG", suite.logFilter());
        }
        CommandResult result = processRunner.run(command);
        if (result.timedOut()) {
            throw new SuiteFailedException(suite.name(), "timed out after " + suite.timeout().toMinutes() + " min");
        }
        if (!result.success()) {
            throw new SuiteFailedException(suite.name(), "exit code " + result.exitCode() + ": " + result.summary());
        }
    }

    void addNodes(NetworkInstance instance, int extraNodes) throws InterruptedException {
        for (int i = 1; i <= extraNodes; i++) {
            instance.addNode(i);
            if (i < extraNodes) {
                sleeper.sleep(network.joinInterval());
            }
        }
    }

    void awaitChurn(JobContext ctx) throws Exception {
        Future<?> churn = ctx.require(CHURN_KEY, Future.class);
        try {
            churn.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception) {
                throw (Exception) e.getCause();
            }
            throw e;
        }
    }

    void checkNoDepartures(JobContext ctx) {
        MembershipSnapshot snapshot = membershipLog.scan(instance(ctx).logSource());
        if (snapshot.hasDepartures()) {
            throw new NodeDepartureException(snapshot.departures());
        }
        log.info("No node departures recorded ({} nodes joined)", snapshot.joinedCount());
    }

    private static NetworkInstance instance(JobContext ctx) {
        return ctx.require(NetworkInstance.CONTEXT_KEY, NetworkInstance.class);
    }
}
