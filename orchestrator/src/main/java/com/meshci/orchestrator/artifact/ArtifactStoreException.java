package com.meshci.orchestrator.artifact;

/**
 * Thrown when the artifact store rejects or fails a read or write.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
