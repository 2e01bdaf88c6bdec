package com.meshci.orchestrator.harness;

/**
 * A test suite exited non-zero or timed out.
 */
public class SuiteFailedException extends RuntimeException {

    private final String suite;

    public SuiteFailedException(String suite, String message) {
        super("Suite '" + suite + "' failed: " + message);
        this.suite = suite;
    }

    public String suite() {
        return suite;
    }
}
