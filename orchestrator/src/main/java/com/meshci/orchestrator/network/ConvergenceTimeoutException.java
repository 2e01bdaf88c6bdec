package com.meshci.orchestrator.network;

import java.time.Duration;

/**
 * Fewer than the expected number of nodes joined before the ceiling.
 */
public class ConvergenceTimeoutException extends RuntimeException {

    private final int      expected;
    private final int      observed;
    private final Duration elapsed;

    public ConvergenceTimeoutException(int expected, int observed, Duration elapsed) {
        super("Network did not converge: " + observed + "/" + expected
                + " nodes joined after " + elapsed.toSeconds() + " s");
        this.expected = expected;
        this.observed = observed;
        this.elapsed  = elapsed;
    }

    public int      expected() { return expected; }
    public int      observed() { return observed; }
    public Duration elapsed()  { return elapsed; }
}
