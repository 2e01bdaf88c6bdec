package com.meshci.orchestrator.pipeline;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A Run's slot in its concurrency group. Holds the Run's cancellation token
 * and a link to the Run it superseded, if any.
 */
public final class RunHandle {

    private final String            group;
    private final UUID              runId;
    private final CancellationToken token = new CancellationToken();
    private final RunHandle         predecessor;
    private final CountDownLatch    finished = new CountDownLatch(1);

    RunHandle(String group, UUID runId, RunHandle predecessor) {
        this.group       = group;
        this.runId       = runId;
        this.predecessor = predecessor;
    }

    public String            group() { return group; }
    public UUID              runId() { return runId; }
    public CancellationToken token() { return token; }

    /**
     * Block until the superseded Run (if any) has released its slot.
     *
     * @return false if the predecessor was still running when {@code maxWait} elapsed
     */
    public boolean awaitPredecessor(Duration maxWait) throws InterruptedException {
        if (predecessor == null) return true;
        return predecessor.finished.await(maxWait.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    void markFinished() {
        finished.countDown();
    }
}
