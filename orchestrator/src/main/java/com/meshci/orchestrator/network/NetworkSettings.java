package com.meshci.orchestrator.network;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Parameters of one ephemeral network.
 *
 * @param nodeCount          N, the nodes the bootstrap binary launches
 * @param joinInterval       delay between node launches
 * @param pollInterval       how often convergence is checked
 * @param convergenceCeiling give up waiting for N joins after this long
 * @param workRoot           per-run, per-job instance directories are created here
 * @param nodeBinary         name of the node binary inside the build archive
 * @param bootstrapBinary    name of the bootstrap binary inside the build archive
 * @param logFilter          RUST_LOG value for the node processes
 * @param nodeArgs           extra-node arguments; {@code {nodeDir}} is replaced by the node's directory
 */
public record NetworkSettings(
        int          nodeCount,
        Duration     joinInterval,
        Duration     pollInterval,
        Duration     convergenceCeiling,
        Path         workRoot,
        String       nodeBinary,
        String       bootstrapBinary,
        String       logFilter,
        List<String> nodeArgs
) {
    public NetworkSettings {
        if (nodeCount < 1) throw new IllegalArgumentException("node count must be at least 1");
        nodeArgs = nodeArgs == null ? List.of() : List.copyOf(nodeArgs);
    }
}
