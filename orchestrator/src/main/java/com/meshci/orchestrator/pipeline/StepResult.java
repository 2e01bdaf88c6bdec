package com.meshci.orchestrator.pipeline;

/**
 * Outcome of one step, kept per Job and serialised into run_jobs.step_results.
 *
 * @param step        step name
 * @param criticality FATAL or ADVISORY, copied from the step definition
 * @param outcome     what happened
 * @param message     failure message, or null on success
 * @param elapsedMs   wall-clock time spent in the step
 */
public record StepResult(
        String      step,
        Criticality criticality,
        StepOutcome outcome,
        String      message,
        long        elapsedMs
) {
    /** True when this result must flip the Job to FAILED. */
    public boolean isBlockingFailure() {
        return criticality == Criticality.FATAL && outcome.isFailure();
    }

    public static StepResult notRun(StepDefinition step, StepOutcome outcome, String message) {
        return new StepResult(step.name(), step.criticality(), outcome, message, 0L);
    }
}
