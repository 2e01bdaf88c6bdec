package com.meshci.orchestrator.release;

/**
 * The release could not be computed, committed, tagged or pushed.
 */
public class ReleaseException extends RuntimeException {

    public ReleaseException(String message) {
        super(message);
    }

    public ReleaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
