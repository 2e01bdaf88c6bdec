package com.meshci.orchestrator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by every Job of one Run.
 *
 * Steps poll {@link #throwIfCancelled()} at their suspension points and
 * register callbacks (e.g. "kill the node processes") that fire once when
 * the Run is cancelled. A failing callback is logged and never prevents
 * the remaining callbacks from running.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    /** Handle returned by {@link #onCancel}; closing it unregisters the callback. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    /** A registered callback; {@code cancel} and a late {@code onCancel} may both reach it. */
    private static final class Callback {
        private final Runnable      action;
        private final AtomicBoolean fired = new AtomicBoolean();

        Callback(Runnable action) {
            this.action = action;
        }

        void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * Cancel the Run. Only the first call has an effect.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            return false;
        }
        for (Callback callback : callbacks) {
            callback.fire();
        }
        return true;
    }

    /**
     * Register a callback fired on cancellation. Runs immediately when the
     * token is already cancelled.
     */
    public Registration onCancel(Runnable action) {
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (isCancelled()) {
            callback.fire();
        }
        return () -> callbacks.remove(callback);
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new RunCancelledException(why);
        }
    }
}
