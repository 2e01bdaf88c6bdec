package com.meshci.orchestrator.service;

import com.meshci.orchestrator.build.BuildPipeline;
import com.meshci.orchestrator.build.BuildSettings;
import com.meshci.orchestrator.config.MeshCiProperties;
import com.meshci.orchestrator.diagnostics.DiagnosticsMode;
import com.meshci.orchestrator.harness.HarnessJobSpec;
import com.meshci.orchestrator.harness.TestHarness;
import com.meshci.orchestrator.harness.TestSuite;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.pipeline.JobDefinition;
import com.meshci.orchestrator.pipeline.JobGraph;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The workflow every trigger runs, assembled from configuration:
 * <pre>
 *   check jobs ──────────────────────────────┐
 *   build ──► harness jobs (e2e, api, ...) ──┴──► gate
 * </pre>
 * The graph is built and validated once, at startup.
 */
@Component
public class WorkflowCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCatalog.class);

    static final String BUILD_JOB = "build";

    private final ProcessRunner processRunner;
    private final Path          workspace;
    private final JobGraph      graph;

    public WorkflowCatalog(MeshCiProperties props,
                           ProcessRunner processRunner,
                           BuildPipeline buildPipeline,
                           BuildSettings buildSettings,
                           TestHarness testHarness) {
        this.processRunner = processRunner;
        this.workspace     = Path.of(props.workspace());

        List<JobDefinition> jobs = new ArrayList<>();
        for (MeshCiProperties.Check check : props.checks() == null ? List.<MeshCiProperties.Check>of() : props.checks()) {
            jobs.add(checkJob(check));
        }
        jobs.add(JobDefinition.job(BUILD_JOB, Set.of(), buildPipeline.steps(buildSettings)));

        MeshCiProperties.Harness harness = props.harness();
        for (MeshCiProperties.HarnessJob job : harness.jobs()) {
            jobs.add(testHarness.job(harnessSpec(job, harness)));
        }

        Set<String> required = new LinkedHashSet<>();
        jobs.forEach(job -> required.add(job.name()));
        jobs.add(JobDefinition.gate(props.gateName(), required));

        this.graph = new JobGraph(jobs);
        log.info("Workflow: {} jobs gated by '{}' in order {}", required.size(), graph.gateName(),
                graph.topologicalOrder());
    }

    public JobGraph graph() {
        return graph;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobDefinition checkJob(MeshCiProperties.Check check) {
        List<StepDefinition> steps = new ArrayList<>();
        for (MeshCiProperties.CheckStep step : check.steps()) {
            steps.add(StepDefinition.fatal(step.name(), step.timeout(), ctx ->
                    processRunner.run(CommandSpec.of(step.command())
                                    .in(workspace)
                                    .withEnv(triggerEnv(ctx.event()))
                                    .withTimeout(step.timeout()))
                            .requireSuccess(step.name())));
        }
        return JobDefinition.job(check.name(), Set.of(), steps);
    }

    private static HarnessJobSpec harnessSpec(MeshCiProperties.HarnessJob job, MeshCiProperties.Harness harness) {
        List<TestSuite> suites = new ArrayList<>();
        for (MeshCiProperties.Suite suite : job.suites() == null ? List.<MeshCiProperties.Suite>of() : job.suites()) {
            suites.add(new TestSuite(suite.name(), suite.command(), suite.timeout(), suite.logFilter(), suite.env()));
        }
        DiagnosticsMode mode = job.diagnostics() == null
                ? DiagnosticsMode.ON_FAILURE
                : DiagnosticsMode.valueOf(job.diagnostics().toUpperCase());
        return new HarnessJobSpec(job.name(), job.label(), Set.of(BUILD_JOB), suites,
                job.churn(), harness.extraNodes(), harness.platform(), mode);
    }

    /** Lets check commands (e.g. the commit linter) see which change they are checking. */
    private static Map<String, String> triggerEnv(TriggerEvent event) {
        Map<String, String> env = new HashMap<>();
        env.put("MESHCI_REF", event.ref());
        if (event.prNumber() != null) {
            env.put("MESHCI_PR_NUMBER", String.valueOf(event.prNumber()));
        }
        return env;
    }
}
