package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;

/**
 * Receives job status transitions from the {@link DagRunner}; the service
 * layer uses it to persist run_jobs rows as the Run progresses.
 *
 * Callbacks are invoked from the runner's coordinating thread, one at a time.
 */
public interface JobStatusListener {

    JobStatusListener NONE = new JobStatusListener() {
        @Override public void onStarted(String job) { }
        @Override public void onFinished(String job, JobExecution execution) { }
    };

    void onStarted(String job);

    void onFinished(String job, JobExecution execution);
}
