package com.browserpilot.core.persistence;

import com.browserpilot.core.graph.Continuation;
import com.browserpilot.core.state.TaskSnapshot;

import java.io.Serializable;

/**
 * A suspended task: its state and where to pick it up again.
 */
public record SessionRecord(TaskSnapshot state, Continuation continuation) implements Serializable {
}
