package com.browserpilot.core.graph;

import com.browserpilot.core.state.TaskState;

/**
 * A unit of the control loop. Reads the task state and decides its own successor.
 * <p>
 * Implementations must not mutate {@code state}; all changes travel in the returned
 * {@link Transition}.
 */
public interface RoutingNode {

    String id();

    Transition apply(TaskState state, RunContext context);
}
