package com.meshci.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Every tunable of the orchestrator, bound from the {@code meshci.*}
 * namespace of application.yml (which carries the defaults).
 */
@ConfigurationProperties(prefix = "meshci")
public record MeshCiProperties(
        String      gateName,
        Duration    predecessorWait,
        Pools       pools,
        Trigger     trigger,
        Artifacts   artifacts,
        String      workspace,
        Build       build,
        Network     network,
        Harness     harness,
        List<Check> checks,
        Diagnostics diagnostics,
        Release     release
) {

    public record Pools(int runThreads, int jobThreads, int stepThreads) {}

    /** Markers of commits and pull requests produced by the release automation. */
    public record Trigger(String releaseCommitMarker, String releasePrTitleMarker) {}

    /**
     * @param backend {@code filesystem} or {@code http}
     * @param root    directory of the filesystem backend
     * @param baseUrl endpoint of the http backend
     */
    public record Artifacts(String backend, String root, String baseUrl, String token, Duration requestTimeout) {}

    public record Build(String targetTriple, Duration timeout, List<Binary> binaries) {}

    public record Binary(String name, List<String> command) {}

    public record Network(
            int          nodeCount,
            Duration     joinInterval,
            Duration     pollInterval,
            Duration     convergenceCeiling,
            String       workRoot,
            String       nodeBinary,
            String       bootstrapBinary,
            String       logFilter,
            List<String> nodeArgs,
            String       joinPattern,
            String       leavePattern
    ) {}

    public record Harness(
            Duration         startTimeout,
            Duration         checkTimeout,
            String           platform,
            int              extraNodes,
            List<HarnessJob> jobs
    ) {}

    /**
     * @param diagnostics {@code ON_FAILURE} or {@code ALWAYS}
     */
    public record HarnessJob(String name, String label, boolean churn, String diagnostics, List<Suite> suites) {}

    public record Suite(String name, List<String> command, Duration timeout, String logFilter, Map<String, String> env) {}

    /** A job of opaque pass/fail commands (formatting, lint, unit tests). */
    public record Check(String name, List<CheckStep> steps) {}

    public record CheckStep(String name, List<String> command, Duration timeout) {}

    public record Diagnostics(List<String> timelineCommand, Duration timeout) {}

    public record Release(
            boolean      enabled,
            String       trunk,
            String       owner,
            String       commitMarker,
            String       repoDir,
            List<String> manifests,
            String       tagPrefix,
            String       remote,
            String       token,
            String       authorName,
            String       authorEmail,
            Duration     gitTimeout
    ) {}
}
