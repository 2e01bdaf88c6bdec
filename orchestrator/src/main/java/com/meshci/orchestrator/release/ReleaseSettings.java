package com.meshci.orchestrator.release;

import java.nio.file.Path;
import java.util.List;

/**
 * @param trunk          branch whose pushes are released
 * @param owner          only pushes to this repository owner are released
 * @param commitMarker   prefix of release commits; such commits are never released again
 * @param repoDir        working copy the release step operates on
 * @param manifests      manifest files (relative to {@code repoDir}) whose version is rewritten
 * @param tagPrefix      prepended to the version to form the tag
 * @param remote         git remote pushed to
 * @param token          push credential, may be empty for credential-less remotes
 */
public record ReleaseSettings(
        String       trunk,
        String       owner,
        String       commitMarker,
        Path         repoDir,
        List<String> manifests,
        String       tagPrefix,
        String       remote,
        String       token
) {
    public ReleaseSettings {
        manifests = manifests == null ? List.of() : List.copyOf(manifests);
        tagPrefix = tagPrefix == null ? "" : tagPrefix;
    }
}
