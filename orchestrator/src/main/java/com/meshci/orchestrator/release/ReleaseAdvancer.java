package com.meshci.orchestrator.release;

import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.model.TriggerKind;
import com.meshci.orchestrator.process.CommandException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Advances the project version after a push to the trunk branch.
 *
 * Releases go through a single-threaded queue, so two trunk pushes landing
 * close together are released one after the other and the second sees the
 * first one's tag. Re-running on unchanged history finds only the release
 * commit since the last tag and does nothing.
 */
public class ReleaseAdvancer {

    private static final Logger log = LoggerFactory.getLogger(ReleaseAdvancer.class);

    private final GitClient       git;
    private final ReleaseSettings settings;
    private final ExecutorService releaseQueue;
    private final MeterRegistry   meterRegistry;

    public ReleaseAdvancer(GitClient git, ReleaseSettings settings, ExecutorService releaseQueue,
                           MeterRegistry meterRegistry) {
        this.git           = git;
        this.settings      = settings;
        this.releaseQueue  = releaseQueue;
        this.meterRegistry = meterRegistry;
    }

    public boolean eligible(TriggerEvent event) {
        return event.kind() == TriggerKind.PUSH
            && ("refs/heads/" + settings.trunk()).equals(event.ref())
            && settings.owner().equals(event.repositoryOwner())
            && !event.headCommitMessage().stripLeading().startsWith(settings.commitMarker());
    }

    /**
     * Queue a release for {@code event}. The outcome is logged and counted in
     * {@code meshci.release.outcomes} whether or not anyone reads the future.
     */
    public Future<ReleaseOutcome> submit(TriggerEvent event) {
        return releaseQueue.submit(() -> {
            try {
                ReleaseOutcome outcome = advance(event);
                record(outcome.status().name());
                return outcome;
            } catch (RuntimeException e) {
                log.error("Release for {} failed: {}", event.ref(), e.getMessage(), e);
                record("FAILED");
                throw e;
            }
        });
    }

    /**
     * @throws ReleaseException if git or a manifest update fails
     */
    public synchronized ReleaseOutcome advance(TriggerEvent event) {
        if (!eligible(event)) {
            log.debug("Trigger on {} is not eligible for a release", event.ref());
            return ReleaseOutcome.ineligible();
        }
        MDC.put("release", settings.trunk());
        try {
            git.syncTo(settings.remote(), settings.trunk(), settings.token());

            Optional<String> latestTag = git.latestTag(settings.tagPrefix());
            SemanticVersion current = latestTag
                    .map(tag -> SemanticVersion.parse(tag.substring(settings.tagPrefix().length())))
                    .orElseGet(this::manifestVersion);

            List<String> releasable = git.commitMessagesSince(latestTag).stream()
                    .filter(message -> !message.startsWith(settings.commitMarker()))
                    .toList();
            BumpLevel level = ConventionalCommits.level(releasable, current);
            if (level == BumpLevel.NONE) {
                log.info("Nothing to release since {} ({})", latestTag.orElse("the first commit"), current);
                return ReleaseOutcome.noChange(current);
            }

            SemanticVersion next = current.bump(level);
            String tag = settings.tagPrefix() + next;
            List<Path> manifests = new ArrayList<>();
            for (String manifest : settings.manifests()) {
                Path path = settings.repoDir().resolve(manifest);
                VersionManifest.write(path, next);
                manifests.add(path);
            }
            String message = settings.commitMarker() + " " + tag;
            git.commit(message, manifests);
            git.tag(tag, message);
            try {
                git.push(settings.remote(), settings.trunk(), settings.token());
            } catch (CommandException e) {
                dropLocalTag(tag);
                throw e;
            }

            log.info("Released {} → {} ({} bump, {} commits)", current, next, level, releasable.size());
            return ReleaseOutcome.released(current, next, tag);
        } catch (CommandException e) {
            throw new ReleaseException("Release failed: " + e.getMessage(), e);
        } finally {
            MDC.remove("release");
        }
    }

    /** An unpushed tag would make every later attempt at the same version fail. */
    private void dropLocalTag(String tag) {
        try {
            git.deleteTag(tag);
        } catch (CommandException e) {
            log.warn("Could not delete unpushed tag {}: {}", tag, e.getMessage());
        }
    }

    private void record(String status) {
        meterRegistry.counter("meshci.release.outcomes", "status", status.toLowerCase()).increment();
    }

    private SemanticVersion manifestVersion() {
        if (settings.manifests().isEmpty()) {
            return new SemanticVersion(0, 0, 0);
        }
        return VersionManifest.read(settings.repoDir().resolve(settings.manifests().get(0)));
    }
}
