package com.meshci.orchestrator.api.dto;

import com.meshci.orchestrator.model.Run;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 */
public record RunResponse(
        UUID    id,
        String  workflow,
        String  ref,
        Integer prNumber,
        String  concurrencyGroup,
        String  state,
        String  gateStatus,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.getId(),
                run.getWorkflow(),
                run.getGitRef(),
                run.getPrNumber(),
                run.getConcurrencyGroup(),
                run.getState().name(),
                run.getGateStatus().name(),
                run.getCreatedAt(),
                run.getUpdatedAt(),
                run.getFinishedAt()
        );
    }
}
