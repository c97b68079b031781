package com.browserpilot.core.graph;

import com.browserpilot.core.model.Outcome;

/**
 * How a run of the control loop stopped.
 */
public sealed interface LoopResult permits LoopResult.Finished, LoopResult.Suspended {

    record Finished(Outcome outcome) implements LoopResult {}

    record Suspended(Continuation continuation) implements LoopResult {}
}
