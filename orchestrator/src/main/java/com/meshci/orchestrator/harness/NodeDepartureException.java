package com.meshci.orchestrator.harness;

import com.meshci.orchestrator.network.LogLine;

import java.util.List;

/**
 * The membership log recorded at least one node leaving the network.
 */
public class NodeDepartureException extends RuntimeException {

    private final List<LogLine> departures;

    public NodeDepartureException(List<LogLine> departures) {
        super(departures.size() + " node departure(s) recorded, first in " + departures.get(0).source()
                + ": " + departures.get(0).text());
        this.departures = List.copyOf(departures);
    }

    public List<LogLine> departures() {
        return departures;
    }
}
