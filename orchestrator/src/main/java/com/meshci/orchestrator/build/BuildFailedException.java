package com.meshci.orchestrator.build;

/**
 * Compilation failed, a binary is missing, or the archive could not be published.
 * Never retried.
 */
public class BuildFailedException extends RuntimeException {

    public BuildFailedException(String message) {
        super(message);
    }

    public BuildFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
