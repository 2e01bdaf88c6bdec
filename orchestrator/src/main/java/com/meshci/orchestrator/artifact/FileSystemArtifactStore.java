package com.meshci.orchestrator.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Artifact store backed by a local (or network-mounted) directory.
 *
 * A blob is written to a temp file next to its destination and then moved
 * into place, so readers only ever see complete blobs. The move does not
 * replace an existing file, which makes every key write-once.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String key, byte[] blob) {
        Path target = resolve(key);
        if (Files.exists(target)) {
            throw new ArtifactStoreException("Artifact already exists: " + key);
        }
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, blob);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target);
            }
            tmp = null;
            log.info("Stored artifact '{}' ({} bytes)", key, blob.length);
        } catch (FileAlreadyExistsException e) {
            throw new ArtifactStoreException("Artifact already exists: " + key, e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to store artifact " + key, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp upload {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + key, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("artifact key cannot be empty");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("artifact key escapes the store root: " + key);
        }
        return path;
    }
}
