package com.meshci.orchestrator.pipeline;

import java.time.Duration;

/**
 * Declaration of one step of a Job.
 *
 * @param name        human-readable step name, used in logs and results
 * @param criticality FATAL or ADVISORY
 * @param condition   ON_SUCCESS, ON_FAILURE or ALWAYS
 * @param timeout     wall-clock limit; the step is interrupted and TIMED_OUT past it
 * @param action      the work to do
 */
public record StepDefinition(
        String       name,
        Criticality  criticality,
        RunCondition condition,
        Duration     timeout,
        StepAction   action
) {

    public StepDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("step name cannot be empty");
        if (action == null) throw new IllegalArgumentException("step action is required: " + name);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("step timeout must be positive: " + name);
        }
        if (criticality == null) criticality = Criticality.FATAL;
        if (condition == null)   condition   = RunCondition.ON_SUCCESS;
    }

    public static StepDefinition fatal(String name, Duration timeout, StepAction action) {
        return new StepDefinition(name, Criticality.FATAL, RunCondition.ON_SUCCESS, timeout, action);
    }

    public static StepDefinition advisory(String name, Duration timeout, StepAction action) {
        return new StepDefinition(name, Criticality.ADVISORY, RunCondition.ON_SUCCESS, timeout, action);
    }

    public StepDefinition when(RunCondition newCondition) {
        return new StepDefinition(name, criticality, newCondition, timeout, action);
    }
}
