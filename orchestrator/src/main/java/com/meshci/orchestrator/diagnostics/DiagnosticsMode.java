package com.meshci.orchestrator.diagnostics;

/** When a harness job captures diagnostics. */
public enum DiagnosticsMode {
    /** Only once the job has failed. */
    ON_FAILURE,
    /** After every run of the job. */
    ALWAYS
}
