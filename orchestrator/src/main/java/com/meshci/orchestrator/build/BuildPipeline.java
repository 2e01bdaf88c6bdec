package com.meshci.orchestrator.build;

import com.meshci.orchestrator.artifact.ArchiveCodec;
import com.meshci.orchestrator.artifact.ArtifactKeys;
import com.meshci.orchestrator.artifact.ArtifactStore;
import com.meshci.orchestrator.artifact.ArtifactStoreException;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.process.CommandResult;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the release binaries once per Run and publishes them as a single
 * archive that every harness job of the Run downloads.
 */
public class BuildPipeline {

    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    private static final Duration UPLOAD_TIMEOUT = Duration.ofMinutes(5);

    private final ProcessRunner processRunner;
    private final ArtifactStore artifactStore;

    public BuildPipeline(ProcessRunner processRunner, ArtifactStore artifactStore) {
        this.processRunner = processRunner;
        this.artifactStore = artifactStore;
    }

    /** One FATAL step per binary, then the publish step. */
    public List<StepDefinition> steps(BuildSettings settings) {
        List<StepDefinition> steps = new ArrayList<>();
        for (BinaryTarget binary : settings.binaries()) {
            steps.add(StepDefinition.fatal("build " + binary.name(), settings.timeout(),
                    ctx -> compile(binary, settings)));
        }
        steps.add(StepDefinition.fatal("publish artifacts", UPLOAD_TIMEOUT,
                ctx -> publish(ctx.runId(), settings)));
        return steps;
    }

    /**
     * @throws BuildFailedException on a non-zero exit or timeout
     */
    public void compile(BinaryTarget binary, BuildSettings settings) {
        log.info("Compiling '{}' for {}", binary.name(), settings.targetTriple());
        CommandResult result = processRunner.run(CommandSpec.of(binary.command())
                .in(settings.workspace())
                .withEnv("CARGO_BUILD_TARGET", settings.targetTriple())
                .withTimeout(settings.timeout()));
        if (result.timedOut()) {
            throw new BuildFailedException("Compiling " + binary.name() + " timed out after "
                    + settings.timeout().toMinutes() + " min");
        }
        if (!result.success()) {
            throw new BuildFailedException("Compiling " + binary.name() + " exited with "
                    + result.exitCode() + ": " + result.summary());
        }
    }

    /**
     * Package every binary into one archive and store it under the Run's key.
     *
     * @return the artifact key
     * @throws BuildFailedException if a binary is missing or the upload fails
     */
    public String publish(UUID runId, BuildSettings settings) {
        Map<String, Path> entries = new LinkedHashMap<>();
        for (BinaryTarget binary : settings.binaries()) {
            Path path = settings.releaseDir().resolve(binary.name());
            if (!Files.isRegularFile(path)) {
                throw new BuildFailedException("Binary '" + binary.name() + "' not found at " + path);
            }
            entries.put(binary.name(), path);
        }
        String key = ArtifactKeys.binaries(runId);
        try {
            byte[] archive = ArchiveCodec.pack(entries);
            artifactStore.put(key, archive);
            log.info("Published {} binaries as '{}' ({} bytes)", entries.size(), key, archive.length);
            return key;
        } catch (ArtifactStoreException | UncheckedIOException e) {
            throw new BuildFailedException("Failed to publish " + key + ": " + e.getMessage(), e);
        }
    }
}
