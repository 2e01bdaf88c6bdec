package com.meshci.orchestrator.pipeline;

/** When a step runs relative to the Job's failure state. */
public enum RunCondition {
    /** Only while no FATAL step of the Job has failed (the default). */
    ON_SUCCESS,
    /** Only after a FATAL step of the Job has failed. */
    ON_FAILURE,
    /** Regardless of failure or cancellation; used for teardown. */
    ALWAYS
}
