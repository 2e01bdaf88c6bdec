package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;

import java.util.List;

/**
 * Final status of one Job together with its per-step results.
 *
 * @param failureReason first blocking failure ("step: message"), or the reason
 *                      the job was skipped / cancelled without running
 */
public record JobExecution(
        JobStatus        status,
        List<StepResult> steps,
        String           failureReason
) {
    public JobExecution {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /** A job that was resolved by the DAG rule without executing any step. */
    public static JobExecution resolved(JobStatus status, String reason) {
        return new JobExecution(status, List.of(), reason);
    }
}
