package io.tokenstreams.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-writer cancellation signal shared between a stream's consumer and its poller.
 *
 * <p>The token moves from active to cancelled exactly once. The consumer writes it through
 * {@link StreamHandle#cancel()}; poller threads only read it. Listeners run once, on the thread
 * that performs the transition.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new ArrayList<>();

    /**
     * Cancels the token.
     *
     * @return {@code true} if this call cancelled it, {@code false} if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        List<Runnable> toRun;
        synchronized (listeners) {
            toRun = List.copyOf(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback for the cancel transition. If the token is already cancelled the
     * callback runs immediately on the calling thread.
     */
    public void onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (listeners) {
            if (!cancelled.get()) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    @Override
    public String toString() {
        return isCancelled() ? "CancellationToken[cancelled]" : "CancellationToken[active]";
    }
}
