package com.browserpilot.core.graph;

import java.util.Objects;

/**
 * Per-run data a node may need besides the task state.
 *
 * @param sessionId    session being driven
 * @param cancellation cooperative cancellation flag
 * @param stepLimit    iteration ceiling for this run; {@code 0} uses the loop's configured default
 */
public record RunContext(String sessionId, CancellationSignal cancellation, int stepLimit) {

    public RunContext {
        Objects.requireNonNull(sessionId, "sessionId");
        cancellation = cancellation != null ? cancellation : new CancellationSignal();
        if (stepLimit < 0) {
            throw new IllegalArgumentException("stepLimit must be >= 0, got " + stepLimit);
        }
    }

    public static RunContext of(String sessionId) {
        return new RunContext(sessionId, new CancellationSignal(), 0);
    }
}
