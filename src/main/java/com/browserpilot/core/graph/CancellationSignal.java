package com.browserpilot.core.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked at iteration boundaries and while a tool batch is in flight.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
