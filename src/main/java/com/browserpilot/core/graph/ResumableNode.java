package com.browserpilot.core.graph;

import com.browserpilot.core.model.Interrupt;
import com.browserpilot.core.state.TaskState;

/**
 * A node that can suspend the loop and later continue with the caller's answer.
 */
public interface ResumableNode extends RoutingNode {

    Transition resume(TaskState state, Interrupt interrupt, String response, RunContext context);
}
