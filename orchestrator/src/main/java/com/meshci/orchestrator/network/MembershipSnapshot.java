package com.meshci.orchestrator.network;

import java.util.List;
import java.util.Set;

/**
 * What the node logs say about membership at one point in time.
 *
 * @param joinedNodes ids of the nodes recorded as joined
 * @param departures  lines recording a membership decision that a node left
 */
public record MembershipSnapshot(Set<String> joinedNodes, List<LogLine> departures) {

    public MembershipSnapshot {
        joinedNodes = Set.copyOf(joinedNodes);
        departures  = List.copyOf(departures);
    }

    public int joinedCount() {
        return joinedNodes.size();
    }

    public boolean hasDepartures() {
        return !departures.isEmpty();
    }

    @Override
    public String toString() {
        return joinedNodes.size() + " joined, " + departures.size() + " departures";
    }
}
