package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.RunState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal statuses of every job of a Run plus the gate verdict.
 */
public record RunOutcome(
        Map<String, JobStatus> statuses,
        String                 gateName,
        boolean                cancelled
) {
    public RunOutcome {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public JobStatus gateStatus() {
        return statuses.getOrDefault(gateName, JobStatus.PENDING);
    }

    public RunState runState() {
        if (cancelled) return RunState.CANCELLED;
        return gateStatus() == JobStatus.SUCCEEDED ? RunState.SUCCEEDED : RunState.FAILED;
    }
}
