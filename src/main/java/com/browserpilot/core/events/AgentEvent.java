package com.browserpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task runs, delivered through the {@link EventBus}.
 *
 * @param eventType event type (e.g. "task.started", "progress", "task.suspended")
 * @param sessionId the session this event belongs to
 * @param node      the routing node that emitted it (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String sessionId,
    String node,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_STARTED = "task.started";
    public static final String TASK_RESUMED = "task.resumed";
    public static final String TASK_SUSPENDED = "task.suspended";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String PROGRESS = "progress";

    public static AgentEvent of(String eventType, String sessionId, String node, Map<String, Object> payload) {
        return new AgentEvent(eventType, sessionId, node, payload != null ? payload : Map.of(), Instant.now());
    }
}
