package com.browserpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of task events.
 * <p>
 * Every subscription carries an {@link EventFilter}. An event reaches each matching
 * subscriber in subscription order, on the publishing thread. A subscriber that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(AgentEvent event) {
        int delivered = 0;
        for (Registration registration : registrations) {
            if (registration.filter().matches(event)) {
                deliverSafely(registration, event);
                delivered++;
            }
        }
        log.debug("Event {} for session {} delivered to {} subscriber(s)",
                event.eventType(), event.sessionId(), delivered);
    }

    /**
     * Registers {@code consumer} for the events {@code filter} accepts. Closing the
     * returned handle ends the subscription.
     */
    public Subscription subscribe(EventFilter filter, Consumer<AgentEvent> consumer) {
        var registration = new Registration(filter, consumer);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliverSafely(Registration registration, AgentEvent event) {
        try {
            registration.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} event: {}", event.eventType(), e.getMessage(), e);
        }
    }

    private record Registration(EventFilter filter, Consumer<AgentEvent> consumer) {
    }
}
