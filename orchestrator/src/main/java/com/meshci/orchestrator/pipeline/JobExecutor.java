package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the steps of one Job in order and derives the Job's status.
 *
 * Rules:
 * <ul>
 *   <li>A FATAL step that fails or times out marks the Job FAILED; later
 *       ON_SUCCESS steps are recorded as SKIPPED.</li>
 *   <li>ON_FAILURE steps run only once the Job has failed; ALWAYS steps run
 *       in every case, including after cancellation.</li>
 *   <li>ADVISORY failures are logged and recorded but never change the
 *       Job's status.</li>
 *   <li>Once the Run is cancelled, running ON_SUCCESS / ON_FAILURE steps are
 *       interrupted and the Job ends CANCELLED.</li>
 * </ul>
 *
 * Each step runs on the step pool so its timeout can be enforced with
 * {@link Future#get(long, TimeUnit)}. Every step is timed and counted:
 * <pre>
 *   meshci.step.duration{job, step, outcome}
 *   meshci.job.outcomes{job, status}
 * </pre>
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutorService stepPool;
    private final MeterRegistry   meterRegistry;

    public JobExecutor(ExecutorService stepPool, MeterRegistry meterRegistry) {
        this.stepPool      = stepPool;
        this.meterRegistry = meterRegistry;
    }

    public JobExecution execute(JobDefinition job, JobContext ctx) {
        MDC.put("runId", String.valueOf(ctx.runId()));
        MDC.put("job",   job.name());
        try {
            log.info("Starting job '{}' ({} steps)", job.name(), job.steps().size());
            String  failureReason = null;
            boolean cancelled     = false;

            for (StepDefinition step : job.steps()) {
                cancelled = cancelled || ctx.token().isCancelled();

                if (!shouldRun(step, ctx.hasFailed(), cancelled)) {
                    StepOutcome notRun = cancelled && step.condition() == RunCondition.ON_SUCCESS
                            ? StepOutcome.CANCELLED
                            : StepOutcome.SKIPPED;
                    ctx.record(StepResult.notRun(step, notRun, null));
                    continue;
                }

                StepResult result = runStep(job, step, ctx);
                ctx.record(result);

                if (result.outcome() == StepOutcome.CANCELLED) {
                    cancelled = true;
                } else if (result.isBlockingFailure()) {
                    if (!ctx.hasFailed()) {
                        failureReason = step.name() + ": " + result.message();
                    }
                    ctx.markFailed();
                    log.error("Step '{}' failed, job '{}' is FAILED: {}",
                            step.name(), job.name(), result.message());
                } else if (result.outcome().isFailure()) {
                    log.warn("Advisory step '{}' failed, job status unchanged: {}",
                            step.name(), result.message());
                }
            }

            JobStatus status = cancelled       ? JobStatus.CANCELLED
                             : ctx.hasFailed() ? JobStatus.FAILED
                             : JobStatus.SUCCEEDED;
            meterRegistry.counter("meshci.job.outcomes",
                    "job", job.name(), "status", status.name().toLowerCase()).increment();
            log.info("Job '{}' finished: {}", job.name(), status);

            if (status == JobStatus.CANCELLED && failureReason == null) {
                failureReason = ctx.token().reason();
            }
            return new JobExecution(status, ctx.results(), failureReason);
        } finally {
            MDC.remove("job");
            MDC.remove("runId");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean shouldRun(StepDefinition step, boolean failed, boolean cancelled) {
        return switch (step.condition()) {
            case ON_SUCCESS -> !failed && !cancelled;
            case ON_FAILURE -> failed && !cancelled;
            case ALWAYS     -> true;
        };
    }

    private StepResult runStep(JobDefinition job, StepDefinition step, JobContext ctx) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();
        String runId = String.valueOf(ctx.runId());

        Future<Void> future = stepPool.submit(() -> {
            MDC.put("runId", runId);
            MDC.put("job",   job.name());
            MDC.put("step",  step.name());
            try {
                step.action().run(ctx);
                return null;
            } finally {
                MDC.clear();
            }
        });

        // Teardown steps (ALWAYS) must finish even when the run is cancelled.
        CancellationToken.Registration registration = step.condition() == RunCondition.ALWAYS
                ? () -> { }
                : ctx.token().onCancel(() -> future.cancel(true));

        StepOutcome outcome;
        String message = null;
        try {
            future.get(step.timeout().toMillis(), TimeUnit.MILLISECONDS);
            outcome = StepOutcome.SUCCEEDED;
        } catch (TimeoutException e) {
            future.cancel(true);
            outcome = StepOutcome.TIMED_OUT;
            message = "timed out after " + format(step.timeout());
        } catch (CancellationException e) {
            outcome = StepOutcome.CANCELLED;
            message = ctx.token().reason();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RunCancelledException) {
                outcome = StepOutcome.CANCELLED;
            } else {
                outcome = StepOutcome.FAILED;
            }
            message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            outcome = StepOutcome.CANCELLED;
            message = "interrupted";
        } finally {
            registration.close();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        sample.stop(meterRegistry.timer("meshci.step.duration",
                "job", job.name(), "step", step.name(), "outcome", outcome.name().toLowerCase()));
        log.info("Step '{}' of job '{}' → {} in {} ms", step.name(), job.name(), outcome, elapsedMs);
        return new StepResult(step.name(), step.criticality(), outcome, message, elapsedMs);
    }

    private static String format(Duration d) {
        return d.toSeconds() >= 60 ? d.toMinutes() + " min" : d.toMillis() + " ms";
    }
}
