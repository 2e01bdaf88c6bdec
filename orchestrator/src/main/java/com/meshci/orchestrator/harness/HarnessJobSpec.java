package com.meshci.orchestrator.harness;

import com.meshci.orchestrator.diagnostics.DiagnosticsMode;

import java.util.List;
import java.util.Set;

/**
 * One harness job of the workflow.
 *
 * @param label      short name used in diagnostics artifact names ({@code e2e}, {@code api}, ...)
 * @param churn      add {@code extraNodes} nodes after the suites and require that none left
 * @param platform   platform label used in diagnostics artifact names
 */
public record HarnessJobSpec(
        String          jobName,
        String          label,
        Set<String>     needs,
        List<TestSuite> suites,
        boolean         churn,
        int             extraNodes,
        String          platform,
        DiagnosticsMode diagnostics
) {
    public HarnessJobSpec {
        if (jobName == null || jobName.isBlank()) throw new IllegalArgumentException("harness job name cannot be empty");
        label       = label == null || label.isBlank() ? jobName : label;
        needs       = needs == null ? Set.of() : Set.copyOf(needs);
        suites      = suites == null ? List.of() : List.copyOf(suites);
        diagnostics = diagnostics == null ? DiagnosticsMode.ON_FAILURE : diagnostics;
        if (churn && extraNodes < 1) {
            throw new IllegalArgumentException("churn job must add at least one node: " + jobName);
        }
    }
}
