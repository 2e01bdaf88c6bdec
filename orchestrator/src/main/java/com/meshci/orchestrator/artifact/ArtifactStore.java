package com.meshci.orchestrator.artifact;

import java.util.Optional;

/**
 * Write-once key → blob store shared by the jobs of a Run.
 *
 * Implementations must reject a second {@code put} for an existing key and
 * must be safe for concurrent {@code get}s.
 */
public interface ArtifactStore {

    /**
     * @throws ArtifactStoreException if the key already exists or the write fails
     */
    void put(String key, byte[] blob);

    /**
     * @return the blob, or empty when no blob exists under {@code key}
     * @throws ArtifactStoreException if the read fails
     */
    Optional<byte[]> get(String key);
}
