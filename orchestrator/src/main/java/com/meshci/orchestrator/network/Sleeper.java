package com.meshci.orchestrator.network;

import java.time.Duration;

/** Pauses the polling thread. Swapped for a clock-advancing fake in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
