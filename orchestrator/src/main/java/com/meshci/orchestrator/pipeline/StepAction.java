package com.meshci.orchestrator.pipeline;

/**
 * The work of a single step. Throwing marks the step FAILED; the
 * step's criticality decides what that means for the Job.
 */
@FunctionalInterface
public interface StepAction {

    void run(JobContext ctx) throws Exception;
}
