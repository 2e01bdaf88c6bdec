package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.TriggerEvent;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Declaration of a Job: its upstream dependencies, the predicate deciding
 * whether it runs for a given trigger event, and its ordered steps.
 *
 * A gate job has no steps. Its status is derived from its dependencies.
 */
public record JobDefinition(
        String                  name,
        Set<String>             needs,
        Predicate<TriggerEvent> runIf,
        List<StepDefinition>    steps,
        boolean                 gate
) {

    private static final Predicate<TriggerEvent> ALWAYS = event -> true;

    public JobDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("job name cannot be empty");
        needs = needs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(needs));
        runIf = runIf == null ? ALWAYS : runIf;
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (gate && !steps.isEmpty()) {
            throw new IllegalArgumentException("gate job cannot declare steps: " + name);
        }
        if (!gate && steps.isEmpty()) {
            throw new IllegalArgumentException("job must declare at least one step: " + name);
        }
    }

    public static JobDefinition job(String name, Set<String> needs, List<StepDefinition> steps) {
        return new JobDefinition(name, needs, ALWAYS, steps, false);
    }

    public static JobDefinition gate(String name, Set<String> needs) {
        return new JobDefinition(name, needs, ALWAYS, List.of(), true);
    }

    public JobDefinition runIf(Predicate<TriggerEvent> predicate) {
        return new JobDefinition(name, needs, predicate, steps, gate);
    }
}
