package com.meshci.orchestrator.pipeline;

/**
 * How a step failure affects the owning Job.
 *
 *   FATAL:    the Job is marked FAILED and remaining ON_SUCCESS steps are not run.
 *   ADVISORY: the failure is logged and recorded; the Job status never changes.
 */
public enum Criticality {
    FATAL,
    ADVISORY
}
