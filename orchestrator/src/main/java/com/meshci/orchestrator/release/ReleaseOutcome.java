package com.meshci.orchestrator.release;

/**
 * What one release invocation did.
 *
 * @param previous version before the release, null when ineligible
 * @param next     version after the release; equal to {@code previous} unless RELEASED
 * @param tag      pushed tag, only set when RELEASED
 */
public record ReleaseOutcome(Status status, SemanticVersion previous, SemanticVersion next, String tag) {

    public enum Status {
        /** The trigger does not qualify for a release. */
        SKIPPED_INELIGIBLE,
        /** No releasable commit since the last tag. */
        NO_CHANGE,
        RELEASED
    }

    public static ReleaseOutcome ineligible() {
        return new ReleaseOutcome(Status.SKIPPED_INELIGIBLE, null, null, null);
    }

    public static ReleaseOutcome noChange(SemanticVersion current) {
        return new ReleaseOutcome(Status.NO_CHANGE, current, current, null);
    }

    public static ReleaseOutcome released(SemanticVersion previous, SemanticVersion next, String tag) {
        return new ReleaseOutcome(Status.RELEASED, previous, next, tag);
    }
}
