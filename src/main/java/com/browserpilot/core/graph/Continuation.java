package com.browserpilot.core.graph;

import com.browserpilot.core.model.Interrupt;

import java.io.Serializable;
import java.time.Instant;

/**
 * Serializable record of a suspension: where to resume and what the caller was asked.
 * The state delta of the suspending node has already been applied to the task state.
 */
public record Continuation(
        String sessionId,
        String resumeNode,
        Interrupt interrupt,
        long step,
        Instant suspendedAt
) implements Serializable {
}
