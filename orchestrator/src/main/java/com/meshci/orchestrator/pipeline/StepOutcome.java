package com.meshci.orchestrator.pipeline;

public enum StepOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    SKIPPED,
    CANCELLED;

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
