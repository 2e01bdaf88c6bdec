package com.meshci.orchestrator.network;

import java.time.Duration;

/**
 * Waits until N distinct nodes of a network have logged the join marker.
 */
public class ConvergencePoller {

    private final Poller        poller;
    private final MembershipLog membershipLog;

    public ConvergencePoller(Poller poller, MembershipLog membershipLog) {
        this.poller        = poller;
        this.membershipLog = membershipLog;
    }

    public MembershipSnapshot awaitConvergence(NetworkInstance instance, int expected) {
        NetworkSettings settings = instance.settings();
        return awaitConvergence(instance.logSource(), expected,
                settings.pollInterval(), settings.convergenceCeiling(),
                instance::checkBootstrapHealthy);
    }

    /**
     * @param livenessCheck run before every read; throws to abort the wait early
     * @throws ConvergenceTimeoutException with the partial join count past the ceiling
     */
    public MembershipSnapshot awaitConvergence(LogSource logs, int expected,
                                               Duration interval, Duration ceiling,
                                               Runnable livenessCheck) {
        try {
            return poller.until(expected + " nodes to join",
                    () -> {
                        livenessCheck.run();
                        return membershipLog.scan(logs);
                    },
                    snapshot -> snapshot.joinedCount() >= expected,
                    interval, ceiling);
        } catch (WaitTimeoutException e) {
            MembershipSnapshot last = (MembershipSnapshot) e.lastValue();
            throw new ConvergenceTimeoutException(expected, last.joinedCount(), e.elapsed());
        }
    }
}
