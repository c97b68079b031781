package com.browserpilot.core.events;

import java.util.Set;

/**
 * Selects the events a subscriber receives.
 *
 * @param sessionId  only events of this session, or any session when null
 * @param eventTypes only these event types, or every type when empty
 */
public record EventFilter(String sessionId, Set<String> eventTypes) {

    public EventFilter {
        eventTypes = eventTypes != null ? Set.copyOf(eventTypes) : Set.of();
    }

    public static EventFilter all() {
        return new EventFilter(null, Set.of());
    }

    public static EventFilter types(String... eventTypes) {
        return new EventFilter(null, Set.of(eventTypes));
    }

    public EventFilter forSession(String sessionId) {
        return new EventFilter(sessionId, eventTypes);
    }

    public boolean matches(AgentEvent event) {
        if (sessionId != null && !sessionId.equals(event.sessionId())) {
            return false;
        }
        return eventTypes.isEmpty() || eventTypes.contains(event.eventType());
    }
}
