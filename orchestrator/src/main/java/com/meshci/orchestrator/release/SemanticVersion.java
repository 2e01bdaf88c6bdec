package com.meshci.orchestrator.release;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code MAJOR.MINOR.PATCH}; pre-release and build suffixes are ignored when parsing.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    private static final Pattern FORMAT = Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)(?:[-+].*)?$");

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must be non-negative");
        }
    }

    /** Accepts {@code 1.2.3} and {@code v1.2.3}. */
    public static SemanticVersion parse(String text) {
        Matcher m = FORMAT.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a semantic version: " + text);
        }
        return new SemanticVersion(Integer.parseInt(m.group(1)),
                                   Integer.parseInt(m.group(2)),
                                   Integer.parseInt(m.group(3)));
    }

    public SemanticVersion bump(BumpLevel level) {
        return switch (level) {
            case NONE  -> this;
            case PATCH -> new SemanticVersion(major, minor, patch + 1);
            case MINOR -> new SemanticVersion(major, minor + 1, 0);
            case MAJOR -> new SemanticVersion(major + 1, 0, 0);
        };
    }

    public boolean isPreStable() {
        return major == 0;
    }

    @Override
    public int compareTo(SemanticVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
