package com.meshci.orchestrator.pipeline;

/**
 * Thrown from inside a step when the owning Run has been cancelled.
 * Not an error: the step and its Job end as CANCELLED.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String reason) {
        super(reason);
    }
}
