package com.meshci.orchestrator.artifact;

import java.util.UUID;

/** Artifact naming, keyed by Run identity. */
public final class ArtifactKeys {

    private ArtifactKeys() {}

    /** The build archive holding every release binary of a Run. */
    public static String binaries(UUID runId) {
        return "artifacts-" + runId + ".zip";
    }

    public static String diagnostics(UUID runId, String fileName) {
        return "runs/" + runId + "/diagnostics/" + fileName;
    }
}
