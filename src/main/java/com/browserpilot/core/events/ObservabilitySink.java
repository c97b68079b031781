package com.browserpilot.core.events;

/**
 * Fire-and-forget receiver for progress events. Implementations must not block the caller.
 */
@FunctionalInterface
public interface ObservabilitySink {

    void emit(AgentEvent event);
}
