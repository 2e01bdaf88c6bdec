package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.TriggerEvent;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable state shared by the steps of one Job execution.
 *
 * Steps hand values to later steps through typed attributes, e.g. the
 * bootstrap step stores the NetworkInstance that the poller, the suites
 * and the teardown step all consume.
 */
public final class JobContext {

    private final UUID              runId;
    private final TriggerEvent      event;
    private final String            jobName;
    private final CancellationToken token;

    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final List<StepResult>    results    = new CopyOnWriteArrayList<>();
    private volatile boolean          failed;

    public JobContext(UUID runId, TriggerEvent event, String jobName, CancellationToken token) {
        this.runId   = runId;
        this.event   = event;
        this.jobName = jobName;
        this.token   = token;
    }

    public UUID              runId()   { return runId; }
    public TriggerEvent      event()   { return event; }
    public String            jobName() { return jobName; }
    public CancellationToken token()   { return token; }

    // ------------------------------------------------------------------
    // Attributes
    // ------------------------------------------------------------------

    public void put(String key, Object value) {
        attributes.put(key, value);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public <T> T require(String key, Class<T> type) {
        return get(key, type).orElseThrow(() -> new IllegalStateException(
                "'" + key + "' is not available in job " + jobName + " (an earlier step did not run)"));
    }

    // ------------------------------------------------------------------
    // Failure state
    // ------------------------------------------------------------------

    public boolean hasFailed() {
        return failed;
    }

    void markFailed() {
        this.failed = true;
    }

    void record(StepResult result) {
        results.add(result);
    }

    public List<StepResult> results() {
        return List.copyOf(results);
    }
}
