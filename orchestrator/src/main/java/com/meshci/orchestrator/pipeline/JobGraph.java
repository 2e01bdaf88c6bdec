package com.meshci.orchestrator.pipeline;

import com.meshci.orchestrator.model.JobStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The job DAG of a workflow: jobs keyed by name, edges from each job to the
 * jobs it needs, and exactly one gate.
 *
 * Construction validates the graph (unique names, known dependencies, no
 * cycles, one gate). {@link #readiness} is the single dependency rule used by
 * the runner for every job, gate included.
 */
public final class JobGraph {

    /** Where a pending job stands with respect to its dependencies. */
    public enum Readiness {
        /** At least one dependency is still pending or running. */
        WAITING,
        /** Every dependency succeeded. */
        READY,
        /** A dependency ended without succeeding; the job cannot succeed. */
        BLOCKED
    }

    private final Map<String, JobDefinition> jobs;
    private final List<String>               order;
    private final String                     gateName;

    public JobGraph(Collection<JobDefinition> definitions) {
        Map<String, JobDefinition> byName = new LinkedHashMap<>();
        String gate = null;
        for (JobDefinition job : definitions) {
            if (byName.putIfAbsent(job.name(), job) != null) {
                throw new IllegalArgumentException("Duplicate job name: " + job.name());
            }
            if (job.gate()) {
                if (gate != null) {
                    throw new IllegalArgumentException("Job graph declares more than one gate: " + gate + ", " + job.name());
                }
                gate = job.name();
            }
        }
        if (gate == null) {
            throw new IllegalArgumentException("Job graph must declare a gate job");
        }
        for (JobDefinition job : byName.values()) {
            for (String dep : job.needs()) {
                if (!byName.containsKey(dep)) {
                    throw new IllegalArgumentException("Job '" + job.name() + "' needs unknown job: " + dep);
                }
            }
        }
        Set<String> visiting = new HashSet<>();
        Set<String> visited  = new HashSet<>();
        for (String name : byName.keySet()) {
            dfsCycleCheck(name, byName, visiting, visited);
        }

        this.jobs     = byName;
        this.gateName = gate;
        this.order    = topologicalSort(byName);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public JobDefinition job(String name) {
        JobDefinition job = jobs.get(name);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + name);
        }
        return job;
    }

    public Collection<JobDefinition> jobs() {
        return jobs.values();
    }

    public String gateName() {
        return gateName;
    }

    /** Jobs in dependency order; ties keep declaration order. */
    public List<String> topologicalOrder() {
        return order;
    }

    /**
     * The dependency rule.
     *
     * A regular job is BLOCKED as soon as any dependency ends in a status
     * other than SUCCEEDED, so skips propagate without waiting for unrelated
     * branches. The gate waits until every dependency is terminal, then is
     * READY iff all of them succeeded.
     */
    public Readiness readiness(String name, Map<String, JobStatus> statuses) {
        JobDefinition job = job(name);
        boolean allTerminal = true;
        boolean anyNotSucceeded = false;
        for (String dep : job.needs()) {
            JobStatus status = statuses.getOrDefault(dep, JobStatus.PENDING);
            if (!status.isTerminal()) {
                allTerminal = false;
            } else if (status != JobStatus.SUCCEEDED) {
                anyNotSucceeded = true;
            }
        }
        if (job.gate()) {
            if (!allTerminal) return Readiness.WAITING;
            return anyNotSucceeded ? Readiness.BLOCKED : Readiness.READY;
        }
        if (anyNotSucceeded) return Readiness.BLOCKED;
        return allTerminal ? Readiness.READY : Readiness.WAITING;
    }

    /** Names of the dependencies of {@code name} that did not succeed. */
    public List<String> unsuccessfulNeeds(String name, Map<String, JobStatus> statuses) {
        List<String> failed = new ArrayList<>();
        for (String dep : job(name).needs()) {
            JobStatus status = statuses.getOrDefault(dep, JobStatus.PENDING);
            if (status.isTerminal() && status != JobStatus.SUCCEEDED) {
                failed.add(dep + "=" + status);
            }
        }
        return failed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void dfsCycleCheck(String name, Map<String, JobDefinition> graph,
                                      Set<String> visiting, Set<String> visited) {
        if (visited.contains(name)) return;
        if (!visiting.add(name)) {
            throw new IllegalArgumentException("Job graph contains a cycle at job: " + name);
        }
        for (String dep : graph.get(name).needs()) {
            dfsCycleCheck(dep, graph, visiting, visited);
        }
        visiting.remove(name);
        visited.add(name);
    }

    // Kahn's algorithm over declaration order.
    private static List<String> topologicalSort(Map<String, JobDefinition> graph) {
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (JobDefinition job : graph.values()) {
            remaining.put(job.name(), job.needs().size());
            for (String dep : job.needs()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(job.name());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        for (JobDefinition job : graph.values()) {
            if (job.needs().isEmpty()) ready.add(job.name());
        }
        List<String> sorted = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            sorted.add(next);
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return List.copyOf(sorted);
    }
}
