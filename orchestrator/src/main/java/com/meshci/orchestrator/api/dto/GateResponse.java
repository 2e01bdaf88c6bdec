package com.meshci.orchestrator.api.dto;

import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.Run;

import java.util.UUID;

/**
 * The merge-readiness signal of a run. mergeReady is true only when the
 * gate job SUCCEEDED.
 */
public record GateResponse(UUID runId, String gate, String status, boolean mergeReady) {

    public static GateResponse from(Run run, String gateName) {
        return new GateResponse(run.getId(), gateName, run.getGateStatus().name(),
                run.getGateStatus() == JobStatus.SUCCEEDED);
    }
}
