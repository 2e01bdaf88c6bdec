package com.meshci.orchestrator.build;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * @param workspace    source checkout the compile commands run in
 * @param targetTriple exported as CARGO_BUILD_TARGET; binaries land in {@code target/<triple>/release}
 * @param binaries     binaries to compile and package, in order
 * @param timeout      limit per compile command
 */
public record BuildSettings(
        Path               workspace,
        String             targetTriple,
        List<BinaryTarget> binaries,
        Duration           timeout
) {
    public BuildSettings {
        if (binaries == null || binaries.isEmpty()) {
            throw new IllegalArgumentException("at least one binary must be built");
        }
        binaries = List.copyOf(binaries);
    }

    public Path releaseDir() {
        return workspace.resolve("target").resolve(targetTriple).resolve("release");
    }
}
