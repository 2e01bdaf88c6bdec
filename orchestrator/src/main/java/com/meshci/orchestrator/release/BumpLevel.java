package com.meshci.orchestrator.release;

/** Version component to increment, ordered from least to most significant. */
public enum BumpLevel {
    NONE, PATCH, MINOR, MAJOR;

    public BumpLevel max(BumpLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
