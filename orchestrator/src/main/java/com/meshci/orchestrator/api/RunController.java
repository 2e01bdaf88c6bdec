package com.meshci.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshci.orchestrator.api.dto.GateResponse;
import com.meshci.orchestrator.api.dto.JobResponse;
import com.meshci.orchestrator.api.dto.RunResponse;
import com.meshci.orchestrator.api.dto.TriggerRequest;
import com.meshci.orchestrator.model.JobRecord;
import com.meshci.orchestrator.model.Run;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for runs.
 *
 * POST /runs              — trigger a run for a push or pull-request event
 * GET  /runs/{id}         — current state of a run
 * GET  /runs/{id}/jobs    — every job of the run with its step results
 * GET  /runs/{id}/gate    — merge readiness
 * POST /runs/{id}/cancel  — cancel a running run
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService   runService;
    private final ObjectMapper objectMapper;

    public RunController(RunService runService, ObjectMapper objectMapper) {
        this.runService   = runService;
        this.objectMapper = objectMapper;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"kind":"PULL_REQUEST","workflow":"pr-checks","prNumber":42,"prTitle":"fix: join race"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> trigger(@RequestBody TriggerRequest req) {
        TriggerEvent event;
        try {
            event = req.toEvent();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        Run run = runService.submit(event);
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(findRun(id));
    }

    @GetMapping("/{id}/jobs")
    public List<JobResponse> getJobs(@PathVariable UUID id) {
        findRun(id);
        return runService.getJobs(id).stream()
                .map(job -> JobResponse.from(job, parseSteps(job)))
                .toList();
    }

    /** The only endpoint the merge bot needs. */
    @GetMapping("/{id}/gate")
    public GateResponse getGate(@PathVariable UUID id) {
        return GateResponse.from(findRun(id), runService.gateName());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable UUID id) {
        if (!runService.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
        }
        return ResponseEntity.accepted().body(Map.of("runId", id.toString(), "status", "cancelling"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Run findRun(UUID id) {
        return runService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    private JsonNode parseSteps(JobRecord job) {
        if (job.getStepResultsJson() == null) {
            return objectMapper.createArrayNode();
        }
        try {
            return objectMapper.readTree(job.getStepResultsJson());
        } catch (Exception e) {
            // Stored results are not valid JSON; return them as raw text
            return objectMapper.getNodeFactory().textNode(job.getStepResultsJson());
        }
    }
}
