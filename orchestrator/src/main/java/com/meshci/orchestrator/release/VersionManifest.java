package com.meshci.orchestrator.release;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and rewrites the package version of a manifest, i.e. the first
 * {@code version = "x.y.z"} line of a Cargo.toml-style file.
 */
public final class VersionManifest {

    private static final Pattern VERSION_LINE = Pattern.compile("(?m)^(version\\s*=\\s*\")([^\"]*)(\")");

    private VersionManifest() {}

    public static SemanticVersion read(Path manifest) {
        Matcher m = VERSION_LINE.matcher(load(manifest));
        if (!m.find()) {
            throw new ReleaseException("No version line in " + manifest);
        }
        return SemanticVersion.parse(m.group(2));
    }

    public static void write(Path manifest, SemanticVersion version) {
        String content = load(manifest);
        Matcher m = VERSION_LINE.matcher(content);
        if (!m.find()) {
            throw new ReleaseException("No version line in " + manifest);
        }
        String updated = content.substring(0, m.start(2)) + version + content.substring(m.end(2));
        try {
            Files.writeString(manifest, updated, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReleaseException("Failed to write " + manifest, e);
        }
    }

    private static String load(Path manifest) {
        try {
            return Files.readString(manifest, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReleaseException("Failed to read " + manifest, e);
        }
    }
}
