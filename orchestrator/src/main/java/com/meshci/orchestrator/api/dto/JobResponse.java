package com.meshci.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshci.orchestrator.model.JobRecord;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one job of a run, returned by GET /runs/{id}/jobs.
 *
 * steps is the stored step-result array, passed through as JSON so callers
 * see which step failed and which advisory steps were tolerated.
 */
public record JobResponse(
        String       name,
        List<String> needs,
        boolean      gate,
        String       status,
        String       failureReason,
        Instant      startedAt,
        Instant      finishedAt,
        JsonNode     steps
) {
    public static JobResponse from(JobRecord job, JsonNode steps) {
        List<String> needs = job.getDependsOn() == null || job.getDependsOn().isBlank()
                ? List.of()
                : List.of(job.getDependsOn().split(","));
        return new JobResponse(
                job.getName(),
                needs,
                job.isGate(),
                job.getStatus().name(),
                job.getFailureReason(),
                job.getStartedAt(),
                job.getFinishedAt(),
                steps
        );
    }
}
