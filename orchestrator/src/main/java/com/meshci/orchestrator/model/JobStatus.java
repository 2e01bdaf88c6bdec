package com.meshci.orchestrator.model;

/**
 * Status of one Job within a Run.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCEEDED | FAILED | CANCELLED
 *   PENDING → SKIPPED   (an upstream job did not succeed, or the run predicate is false)
 *   PENDING → CANCELLED (the Run was superseded before the job started)
 *
 * The Gate never passes through RUNNING: it resolves straight from PENDING
 * once every dependency is terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
