package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Evaluates a {@link JobGraph} for one Run.
 *
 * The calling thread coordinates: it walks the graph in topological order,
 * resolves every job it can (READY jobs are dispatched to the job pool,
 * BLOCKED jobs are skipped, the gate is decided), then waits for the next
 * job to finish and repeats until nothing is in flight.
 *
 * Independent jobs run in parallel; the only ordering guarantee is the one
 * declared by the graph's edges.
 */
public class DagRunner {

    private static final Logger log = LoggerFactory.getLogger(DagRunner.class);

    private final ExecutorService jobPool;
    private final JobExecutor     jobExecutor;
    private final TriggerFilter   triggerFilter;

    public DagRunner(ExecutorService jobPool, JobExecutor jobExecutor, TriggerFilter triggerFilter) {
        this.jobPool       = jobPool;
        this.jobExecutor   = jobExecutor;
        this.triggerFilter = triggerFilter;
    }

    private record Finished(String job, JobExecution execution) {}

    public RunOutcome run(JobGraph graph,
                          UUID runId,
                          TriggerEvent event,
                          CancellationToken token,
                          JobStatusListener listener) {
        Map<String, JobStatus> statuses = new LinkedHashMap<>();
        for (String name : graph.topologicalOrder()) {
            statuses.put(name, JobStatus.PENDING);
        }

        if (triggerFilter.isAutomatedRelease(event)) {
            log.info("Run {} is an automated release commit; skipping every job except the gate", runId);
            for (String name : graph.topologicalOrder()) {
                if (name.equals(graph.gateName())) continue;
                resolve(name, JobStatus.SKIPPED, "automated release commit", statuses, listener);
            }
            resolve(graph.gateName(), JobStatus.SUCCEEDED, null, statuses, listener);
            return new RunOutcome(statuses, graph.gateName(), false);
        }

        CompletionService<Finished> completions = new ExecutorCompletionService<>(jobPool);
        int inFlight = 0;
        while (true) {
            inFlight += dispatch(graph, runId, event, token, statuses, completions, listener);
            if (inFlight == 0) {
                break;
            }
            Finished finished = awaitNext(completions, token);
            inFlight--;
            statuses.put(finished.job(), finished.execution().status());
            listener.onFinished(finished.job(), finished.execution());
        }

        boolean cancelled = token.isCancelled();
        log.info("Run {} finished: gate '{}' = {}{}", runId, graph.gateName(),
                statuses.get(graph.gateName()), cancelled ? " (cancelled)" : "");
        return new RunOutcome(statuses, graph.gateName(), cancelled);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * One pass over the pending jobs in topological order. Because the order
     * is topological, a skip decided early in the pass is already visible to
     * the job's dependents later in the same pass.
     *
     * @return number of jobs newly submitted to the pool
     */
    private int dispatch(JobGraph graph,
                         UUID runId,
                         TriggerEvent event,
                         CancellationToken token,
                         Map<String, JobStatus> statuses,
                         CompletionService<Finished> completions,
                         JobStatusListener listener) {
        int submitted = 0;
        for (String name : graph.topologicalOrder()) {
            if (statuses.get(name) != JobStatus.PENDING) continue;
            JobDefinition job = graph.job(name);

            if (token.isCancelled()) {
                resolve(name, JobStatus.CANCELLED, token.reason(), statuses, listener);
                continue;
            }

            switch (graph.readiness(name, statuses)) {
                case WAITING -> { }
                case BLOCKED -> {
                    List<String> failedNeeds = graph.unsuccessfulNeeds(name, statuses);
                    JobStatus status = job.gate() ? JobStatus.FAILED : JobStatus.SKIPPED;
                    resolve(name, status, "dependencies did not succeed: " + failedNeeds, statuses, listener);
                }
                case READY -> {
                    if (job.gate()) {
                        resolve(name, JobStatus.SUCCEEDED, null, statuses, listener);
                    } else if (!job.runIf().test(event)) {
                        resolve(name, JobStatus.SKIPPED, "run predicate not satisfied", statuses, listener);
                    } else {
                        statuses.put(name, JobStatus.RUNNING);
                        listener.onStarted(name);
                        JobContext ctx = new JobContext(runId, event, name, token);
                        completions.submit(() -> new Finished(name, executeSafely(job, ctx)));
                        submitted++;
                    }
                }
            }
        }
        return submitted;
    }

    private JobExecution executeSafely(JobDefinition job, JobContext ctx) {
        try {
            return jobExecutor.execute(job, ctx);
        } catch (RuntimeException e) {
            log.error("Unhandled error executing job '{}': {}", job.name(), e.getMessage(), e);
            return new JobExecution(JobStatus.FAILED, ctx.results(), "Unhandled exception: " + e.getMessage());
        }
    }

    private Finished awaitNext(CompletionService<Finished> completions, CancellationToken token) {
        while (true) {
            try {
                Future<Finished> done = completions.take();
                return done.get();
            } catch (InterruptedException e) {
                // Running jobs observe the token and finish as CANCELLED; keep draining.
                token.cancel("orchestrator interrupted");
            } catch (ExecutionException e) {
                // executeSafely never throws, so this only happens on pool failures.
                throw new IllegalStateException("Job execution failed unexpectedly", e.getCause());
            }
        }
    }

    private static void resolve(String name, JobStatus status, String reason,
                                Map<String, JobStatus> statuses, JobStatusListener listener) {
        statuses.put(name, status);
        listener.onFinished(name, JobExecution.resolved(status, reason));
        if (status == JobStatus.SKIPPED || status == JobStatus.CANCELLED) {
            log.info("Job '{}' {}: {}", name, status, reason);
        }
    }
}
