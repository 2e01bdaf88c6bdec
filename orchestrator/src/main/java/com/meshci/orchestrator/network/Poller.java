package com.meshci.orchestrator.network;

import com.meshci.orchestrator.pipeline.RunCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-interval wait-until with a hard ceiling.
 *
 * The observer is called immediately and then once per interval. The last
 * evaluation happens at (or just past) the ceiling, so a condition that
 * becomes true exactly at the ceiling still passes. Time is read from the
 * injected {@link Clock} and waiting goes through the injected
 * {@link Sleeper}, which lets tests run minutes of simulated time instantly.
 */
public class Poller {

    private static final Logger log = LoggerFactory.getLogger(Poller.class);

    private final Clock   clock;
    private final Sleeper sleeper;

    public Poller(Clock clock, Sleeper sleeper) {
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    /**
     * @param what     description for logs and the timeout message
     * @param observe  reads the current value; exceptions abort the wait
     * @param done     condition on the observed value
     * @return the first value satisfying {@code done}
     * @throws WaitTimeoutException  if the ceiling passes first
     * @throws RunCancelledException if the waiting thread is interrupted
     */
    public <T> T until(String what, Supplier<T> observe, Predicate<T> done,
                       Duration interval, Duration ceiling) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
        Instant start = clock.instant();
        while (true) {
            T value = observe.get();
            Duration elapsed = Duration.between(start, clock.instant());
            if (done.test(value)) {
                log.info("{}: satisfied after {} s ({})", what, elapsed.toSeconds(), value);
                return value;
            }
            if (elapsed.compareTo(ceiling) >= 0) {
                throw new WaitTimeoutException(what, value, elapsed);
            }
            log.debug("{}: not yet after {} s ({})", what, elapsed.toSeconds(), value);

            Duration remaining = ceiling.minus(elapsed);
            try {
                sleeper.sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("interrupted while waiting for " + what);
            }
        }
    }
}
