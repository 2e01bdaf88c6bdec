package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.TriggerEvent;

import java.util.List;

/**
 * Recognises commits and pull requests produced by the release automation.
 * For those, the whole DAG is skipped and only the gate resolves (trivially
 * succeeding), so a release commit never re-triggers the full battery.
 */
public class TriggerFilter {

    private final List<String> commitMarkers;
    private final List<String> prTitleMarkers;

    public TriggerFilter(List<String> commitMarkers, List<String> prTitleMarkers) {
        this.commitMarkers  = commitMarkers == null ? List.of() : List.copyOf(commitMarkers);
        this.prTitleMarkers = prTitleMarkers == null ? List.of() : List.copyOf(prTitleMarkers);
    }

    public boolean isAutomatedRelease(TriggerEvent event) {
        return startsWithAny(event.headCommitMessage(), commitMarkers)
            || startsWithAny(event.prTitle(), prTitleMarkers);
    }

    private static boolean startsWithAny(String value, List<String> markers) {
        if (value == null || value.isBlank()) return false;
        String trimmed = value.stripLeading();
        return markers.stream().anyMatch(trimmed::startsWith);
    }
}
