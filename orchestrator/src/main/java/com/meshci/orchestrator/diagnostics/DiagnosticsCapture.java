package com.meshci.orchestrator.diagnostics;

import com.meshci.orchestrator.artifact.ArchiveCodec;
import com.meshci.orchestrator.artifact.ArtifactKeys;
import com.meshci.orchestrator.artifact.ArtifactStore;
import com.meshci.orchestrator.network.LogSource;
import com.meshci.orchestrator.network.NetworkInstance;
import com.meshci.orchestrator.pipeline.RunCondition;
import com.meshci.orchestrator.pipeline.StepDefinition;
import com.meshci.orchestrator.process.CommandResult;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Captures what is needed to debug a failed harness job: a timeline image
 * rendered from the node logs and a bundle of the raw logs.
 *
 * Both captures are ADVISORY steps. A missing generator, an empty log
 * directory or an upload error is recorded on the step and logged, and the
 * job keeps whatever status its other steps gave it.
 */
public class DiagnosticsCapture {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsCapture.class);

    private final ProcessRunner       processRunner;
    private final ArtifactStore       artifactStore;
    private final DiagnosticsSettings settings;

    public DiagnosticsCapture(ProcessRunner processRunner, ArtifactStore artifactStore,
                              DiagnosticsSettings settings) {
        this.processRunner = processRunner;
        this.artifactStore = artifactStore;
        this.settings      = settings;
    }

    public List<StepDefinition> steps(String suite, String platform, DiagnosticsMode mode) {
        RunCondition condition = mode == DiagnosticsMode.ALWAYS ? RunCondition.ALWAYS : RunCondition.ON_FAILURE;
        return List.of(
                StepDefinition.advisory("generate timeline", settings.timeout(),
                        ctx -> captureTimeline(ctx.runId(),
                                ctx.require(NetworkInstance.CONTEXT_KEY, NetworkInstance.class), suite, platform))
                        .when(condition),
                StepDefinition.advisory("bundle node logs", settings.timeout(),
                        ctx -> bundleLogs(ctx.runId(),
                                ctx.require(NetworkInstance.CONTEXT_KEY, NetworkInstance.class).logSource(),
                                suite, platform))
                        .when(condition));
    }

    /**
     * Run the timeline generator against the instance's logs and store its stdout.
     *
     * @return the artifact key
     */
    public String captureTimeline(UUID runId, NetworkInstance instance, String suite, String platform) {
        if (settings.timelineCommand().isEmpty()) {
            throw new DiagnosticsException("No timeline command configured");
        }
        String name = "statemap_" + suite + "_" + platform + ".svg";
        Path out = instance.instanceDir().resolve("diagnostics").resolve(name);
        Path err = instance.instanceDir().resolve("diagnostics").resolve(name + ".stderr");
        try {
            Files.deleteIfExists(out);
            CommandResult result = processRunner.run(CommandSpec.of(settings.timelineCommand())
                    .in(settings.workingDir())
                    .withEnv(instance.environment())
                    .withTimeout(settings.timeout())
                    .writingTo(out)
                    .errorsTo(err));
            if (!result.success()) {
                throw new DiagnosticsException("Timeline generator " + (result.timedOut()
                        ? "timed out" : "exited with " + result.exitCode()));
            }
            byte[] svg = Files.readAllBytes(out);
            if (svg.length == 0) {
                throw new DiagnosticsException("Timeline generator produced no output");
            }
            return upload(runId, name, svg);
        } catch (IOException e) {
            throw new DiagnosticsException("Failed to read timeline output " + out, e);
        }
    }

    /**
     * Zip every {@code *.log*} file of the log source and store the bundle.
     *
     * @return the artifact key
     */
    public String bundleLogs(UUID runId, LogSource logs, String suite, String platform) {
        if (logs.files().isEmpty()) {
            throw new DiagnosticsException("No log files under " + logs.root());
        }
        byte[] bundle = ArchiveCodec.packTree(logs.root(), ArchiveCodec::isLogFile);
        return upload(runId, "node_logs_" + suite + "_" + platform + ".zip", bundle);
    }

    private String upload(UUID runId, String name, byte[] blob) {
        String key = ArtifactKeys.diagnostics(runId, name);
        artifactStore.put(key, blob);
        log.info("Captured diagnostics '{}' ({} bytes)", key, blob.length);
        return key;
    }
}
