package com.browserpilot.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Publishes progress events to the {@link EventBus} on a background thread, so slow
 * subscribers never hold up the control loop.
 */
@Component
public class EventBusObservabilitySink implements ObservabilitySink {

    private static final Logger log = LoggerFactory.getLogger(EventBusObservabilitySink.class);

    private final EventBus eventBus;
    private final ExecutorService executor;

    public EventBusObservabilitySink(EventBus eventBus) {
        this(eventBus, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "observability-sink");
            t.setDaemon(true);
            return t;
        }));
    }

    EventBusObservabilitySink(EventBus eventBus, ExecutorService executor) {
        this.eventBus = eventBus;
        this.executor = executor;
    }

    @Override
    public void emit(AgentEvent event) {
        try {
            executor.execute(() -> eventBus.publish(event));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping {} event for session {}: sink is shut down", event.eventType(), event.sessionId());
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }
}
