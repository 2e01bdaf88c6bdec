package com.meshci.orchestrator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces "at most one active Run per concurrency group".
 *
 * {@link #acquire} is called when a Run is submitted. If the group already
 * has an active Run, that Run's token is cancelled and the new handle keeps
 * a link to it; before starting any Job the new Run waits on
 * {@link RunHandle#awaitPredecessor} so the old Run reaches CANCELLED first.
 */
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final Map<String, RunHandle> active = new HashMap<>();
    private final Map<UUID, RunHandle>   byRun  = new ConcurrentHashMap<>();

    public synchronized RunHandle acquire(String group, UUID runId) {
        RunHandle previous = active.get(group);
        if (previous != null && previous.isFinished()) {
            previous = null;
        }
        RunHandle handle = new RunHandle(group, runId, previous);
        active.put(group, handle);
        byRun.put(runId, handle);
        if (previous != null && previous.token().cancel("superseded by run " + runId)) {
            log.info("Run {} supersedes run {} in group '{}'", runId, previous.runId(), group);
        }
        return handle;
    }

    /** Mark the Run finished and free its slot unless a newer Run already took it. */
    public synchronized void release(RunHandle handle) {
        active.remove(handle.group(), handle);
        byRun.remove(handle.runId());
        handle.markFinished();
    }

    /** @return true if the Run was active and this call cancelled it */
    public boolean cancel(UUID runId, String reason) {
        RunHandle handle = byRun.get(runId);
        return handle != null && handle.token().cancel(reason);
    }

    public synchronized Optional<UUID> activeRun(String group) {
        return Optional.ofNullable(active.get(group)).map(RunHandle::runId);
    }
}
