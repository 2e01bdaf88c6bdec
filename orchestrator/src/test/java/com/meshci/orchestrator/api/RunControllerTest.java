package com.meshci.orchestrator.api;

import com.meshci.orchestrator.model.JobRecord;
import com.meshci.orchestrator.model.JobStatus;
import com.meshci.orchestrator.model.Run;
import com.meshci.orchestrator.model.RunState;
import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.service.RunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RunController.
 *
 * Only the web layer is started; RunService is a mock.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired MockMvc     mockMvc;
    @MockitoBean RunService runService;

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void trigger_pullRequest_returns201WithQueuedRun() throws Exception {
        Run run = fakeRun(TriggerEvent.pullRequest("pr-checks", 42, "fix: join race", "alice", "maidsafe"));
        when(runService.submit(any())).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"PULL_REQUEST","workflow":"pr-checks","prNumber":42,"prTitle":"fix: join race"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.state").value("QUEUED"))
                .andExpect(jsonPath("$.ref").value("refs/pull/42/merge"))
                .andExpect(jsonPath("$.concurrencyGroup").value("pr-checks-pr42"));
    }

    @Test
    void trigger_missingWorkflow_returns400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"PUSH","ref":"refs/heads/main"}
                                """))
                .andExpect(status().isBadRequest());

        verify(runService, never()).submit(any());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_existingId_returns200() throws Exception {
        Run run = fakeRun(push());
        run.setState(RunState.RUNNING);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.gateStatus").value("PENDING"));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        when(runService.findById(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/jobs
    // ------------------------------------------------------------------

    @Test
    void getJobs_returnsNeedsAndParsedStepResults() throws Exception {
        Run run = fakeRun(push());
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        JobRecord e2e = new JobRecord(run, "e2e", "build", false);
        e2e.setStatus(JobStatus.FAILED);
        e2e.setFailureReason("run e2e: exit code 101");
        e2e.setStepResultsJson("[{\"step\":\"run e2e\",\"outcome\":\"FAILED\"}]");
        JobRecord gate = new JobRecord(run, "ci", "checks,e2e", true);
        gate.setStatus(JobStatus.FAILED);
        when(runService.getJobs(run.getId())).thenReturn(List.of(e2e, gate));

        mockMvc.perform(get("/runs/{id}/jobs", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("e2e"))
                .andExpect(jsonPath("$[0].needs[0]").value("build"))
                .andExpect(jsonPath("$[0].steps[0].outcome").value("FAILED"))
                .andExpect(jsonPath("$[1].gate").value(true))
                .andExpect(jsonPath("$[1].needs.length()").value(2))
                .andExpect(jsonPath("$[1].steps").isArray());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/gate
    // ------------------------------------------------------------------

    @Test
    void getGate_succeeded_mergeReady() throws Exception {
        Run run = fakeRun(push());
        run.setGateStatus(JobStatus.SUCCEEDED);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));
        when(runService.gateName()).thenReturn("ci");

        mockMvc.perform(get("/runs/{id}/gate", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gate").value("ci"))
                .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.mergeReady").value(true));
    }

    @Test
    void getGate_skippedDependencyFailedGate_notMergeReady() throws Exception {
        Run run = fakeRun(push());
        run.setGateStatus(JobStatus.FAILED);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));
        when(runService.gateName()).thenReturn("ci");

        mockMvc.perform(get("/runs/{id}/gate", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.mergeReady").value(false));
    }

    // ------------------------------------------------------------------
    // POST /runs/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_existingRun_returns202() throws Exception {
        UUID id = UUID.randomUUID();
        when(runService.cancel(id)).thenReturn(true);

        mockMvc.perform(post("/runs/{id}/cancel", id))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("cancelling"));
    }

    @Test
    void cancel_unknownRun_returns404() throws Exception {
        when(runService.cancel(any())).thenReturn(false);

        mockMvc.perform(post("/runs/{id}/cancel", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TriggerEvent push() {
        return TriggerEvent.push("merge", "refs/heads/main", "fix: a", "alice", "maidsafe");
    }

    private Run fakeRun(TriggerEvent event) {
        Run run = new Run(event);
        try {
            var f = run.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
