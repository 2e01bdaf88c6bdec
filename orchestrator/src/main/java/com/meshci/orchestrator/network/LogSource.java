package com.meshci.orchestrator.network;

import java.nio.file.Path;
import java.util.List;

/**
 * Handle on the logs of one Network Instance. Every consumer (convergence
 * polling, departure checks, diagnostics) reads through the handle of its
 * own instance rather than a fixed global path.
 */
public interface LogSource {

    /** Directory holding the node logs. */
    Path root();

    /** Current log files ({@code *.log*}); empty if nothing was written yet. */
    List<Path> files();

    /** Snapshot of every line written so far. */
    List<LogLine> lines();
}
