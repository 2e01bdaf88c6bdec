package com.meshci.orchestrator.model;

/**
 * Lifecycle of a whole Run.
 *
 *   QUEUED → RUNNING → SUCCEEDED | FAILED
 *
 * Any non-terminal Run moves to CANCELLED when a newer Run in the same
 * concurrency group supersedes it, or when it is cancelled through the API.
 * SUCCEEDED / FAILED mirror the Gate status.
 */
public enum RunState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
