package com.browserpilot.core.engine;

import com.browserpilot.core.graph.Continuation;
import com.browserpilot.core.graph.LoopResult;
import com.browserpilot.core.model.Outcome;
import com.browserpilot.core.state.TaskState;

import java.util.Optional;

/**
 * Where a task stands after the engine hands control back.
 */
public record TaskRun(String sessionId, LoopResult result, TaskState state) {

    public boolean isSuspended() {
        return result instanceof LoopResult.Suspended;
    }

    public Optional<Outcome> outcome() {
        return result instanceof LoopResult.Finished finished ? Optional.of(finished.outcome()) : Optional.empty();
    }

    public Optional<Continuation> continuation() {
        return result instanceof LoopResult.Suspended suspended
                ? Optional.of(suspended.continuation())
                : Optional.empty();
    }
}
