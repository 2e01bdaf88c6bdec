package com.meshci.orchestrator.network;

import java.time.Duration;

/**
 * Thrown by {@link Poller#until} when the condition still does not hold
 * at the ceiling. Carries the last value observed.
 */
public class WaitTimeoutException extends RuntimeException {

    private final transient Object lastValue;
    private final Duration         elapsed;

    public WaitTimeoutException(String what, Object lastValue, Duration elapsed) {
        super("Gave up waiting for " + what + " after " + elapsed.toSeconds() + " s (last observed: " + lastValue + ")");
        this.lastValue = lastValue;
        this.elapsed   = elapsed;
    }

    public Object lastValue() {
        return lastValue;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
