package com.meshci.orchestrator.network;

import com.meshci.orchestrator.artifact.ArchiveCodec;
import com.meshci.orchestrator.artifact.ArtifactKeys;
import com.meshci.orchestrator.artifact.ArtifactStore;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;

/**
 * Brings up an ephemeral network from the Run's build archive.
 *
 * Layout of an instance directory:
 * <pre>
 *   &lt;workRoot&gt;/&lt;runId&gt;/&lt;job&gt;/
 *     bin/                          unpacked build archive
 *     .safe/node/&lt;node binary&gt;      where the bootstrap binary looks for it
 *     .safe/node/local-test-network/ node logs (the instance's LogSource)
 *     bootstrap.out                 bootstrap stdout/stderr
 * </pre>
 */
public class NetworkBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(NetworkBootstrapper.class);

    static final String LOG_DIR = "local-test-network";

    private final ArtifactStore artifactStore;
    private final ProcessRunner processRunner;

    public NetworkBootstrapper(ArtifactStore artifactStore, ProcessRunner processRunner) {
        this.artifactStore = artifactStore;
        this.processRunner = processRunner;
    }

    /**
     * @throws NetworkException if the build archive is missing or lacks a binary
     */
    public NetworkInstance launch(UUID runId, String jobName, NetworkSettings settings) {
        Path instanceDir = settings.workRoot().resolve(runId.toString()).resolve(jobName).toAbsolutePath();
        Path binDir      = instanceDir.resolve("bin");
        Path nodeHome    = instanceDir.resolve(".safe").resolve("node");
        Path logRoot     = nodeHome.resolve(LOG_DIR);

        String key = ArtifactKeys.binaries(runId);
        byte[] archive = artifactStore.get(key)
                .orElseThrow(() -> new NetworkException("Build archive not found: " + key));

        try {
            List<Path> files = ArchiveCodec.unpack(archive, binDir);
            for (Path file : files) {
                file.toFile().setExecutable(true, false);
            }
            Path node      = requireBinary(binDir, settings.nodeBinary());
            Path bootstrap = requireBinary(binDir, settings.bootstrapBinary());

            Files.createDirectories(logRoot);
            Path nodeCopy = nodeHome.resolve(settings.nodeBinary());
            Files.copy(node, nodeCopy, StandardCopyOption.REPLACE_EXISTING);
            nodeCopy.toFile().setExecutable(true, false);

            log.info("Launching {}-node network in {} (join interval {} ms)",
                    settings.nodeCount(), instanceDir, settings.joinInterval().toMillis());
            Process process = processRunner.start(CommandSpec.of(List.of(
                            bootstrap.toString(), "--interval", String.valueOf(settings.joinInterval().toMillis())))
                    .in(instanceDir)
                    .withEnv("HOME", instanceDir.toString())
                    .withEnv("NODE_COUNT", String.valueOf(settings.nodeCount()))
                    .withEnv("RUST_LOG", settings.logFilter())
                    .writingTo(instanceDir.resolve("bootstrap.out")));

            return new NetworkInstance(instanceDir, binDir, settings, process,
                    new DirectoryLogSource(logRoot), processRunner);
        } catch (IOException | UncheckedIOException e) {
            throw new NetworkException("Failed to prepare network instance in " + instanceDir, e);
        }
    }

    private static Path requireBinary(Path binDir, String name) {
        Path path = binDir.resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new NetworkException("Build archive does not contain binary '" + name + "'");
        }
        return path;
    }
}
