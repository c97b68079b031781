package com.browserpilot.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus} and the sink that feeds it.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static AgentEvent event(String type, String sessionId) {
        return new AgentEvent(type, sessionId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("AgentEvent")
    class AgentEventTests {

        @Test
        @DisplayName("factory fills the timestamp and defaults a null payload")
        void factoryDefaults() {
            var event = AgentEvent.of("progress", "BP-2026-0001", "progress_reporter", null);

            assertEquals("progress", event.eventType());
            assertEquals("progress_reporter", event.node());
            assertEquals(Map.of(), event.payload());
            assertNotNull(event.timestamp());
        }
    }

    @Nested
    @DisplayName("filters")
    class FilterTests {

        @Test
        @DisplayName("a session filter ignores other sessions")
        void sessionScoped() {
            var filter = EventFilter.all().forSession("BP-2026-0001");

            assertTrue(filter.matches(event("task.started", "BP-2026-0001")));
            assertFalse(filter.matches(event("task.started", "BP-2026-0002")));
        }

        @Test
        @DisplayName("a type filter matches only the named types, across sessions")
        void typeScoped() {
            var filter = EventFilter.types(AgentEvent.PROGRESS);

            assertTrue(filter.matches(event("progress", "BP-2026-0001")));
            assertTrue(filter.matches(event("progress", "BP-2026-0002")));
            assertFalse(filter.matches(event("task.completed", "BP-2026-0001")));
        }

        @Test
        @DisplayName("session and type combine")
        void combined() {
            var filter = EventFilter.types(AgentEvent.PROGRESS, AgentEvent.TASK_FAILED).forSession("BP-2026-0001");

            assertTrue(filter.matches(event("task.failed", "BP-2026-0001")));
            assertFalse(filter.matches(event("task.failed", "BP-2026-0002")));
            assertFalse(filter.matches(event("task.started", "BP-2026-0001")));
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only the events a subscription's filter accepts")
        void filtered() {
            List<AgentEvent> progress = new ArrayList<>();
            List<AgentEvent> everything = new ArrayList<>();
            eventBus.subscribe(EventFilter.types(AgentEvent.PROGRESS).forSession("BP-2026-0001"), progress::add);
            eventBus.subscribe(EventFilter.all(), everything::add);

            var report = event("progress", "BP-2026-0001");
            eventBus.publish(event("task.started", "BP-2026-0001"));
            eventBus.publish(report);
            eventBus.publish(event("progress", "BP-2026-0002"));

            assertEquals(List.of(report), progress);
            assertEquals(3, everything.size());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void inOrder() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.all().forSession("BP-2026-0001"), received::add);

            eventBus.publish(event("task.started", "BP-2026-0001"));
            eventBus.publish(event("progress", "BP-2026-0001"));
            eventBus.publish(event("task.completed", "BP-2026-0001"));

            assertEquals(List.of("task.started", "progress", "task.completed"),
                    received.stream().map(AgentEvent::eventType).toList());
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void isolatesFailures() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.all(), e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe(EventFilter.all(), received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("progress", "BP-2026-0001")));
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery of future events")
        void stopsDelivery() {
            List<AgentEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(EventFilter.all(), received::add);

            subscription.unsubscribe();
            eventBus.publish(event("progress", "BP-2026-0001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("closing the handle ends the subscription")
        void closeEndsSubscription() {
            List<AgentEvent> received = new ArrayList<>();
            try (var subscription = eventBus.subscribe(EventFilter.types(AgentEvent.PROGRESS), received::add)) {
                eventBus.publish(event("progress", "BP-2026-0001"));
            }
            eventBus.publish(event("progress", "BP-2026-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("removing one of two identical subscriptions keeps the other")
        void identicalSubscriptions() {
            List<AgentEvent> received = new ArrayList<>();
            var first = eventBus.subscribe(EventFilter.all(), received::add);
            Consumer<AgentEvent> same = received::add;
            eventBus.subscribe(EventFilter.all(), same);

            first.unsubscribe();
            eventBus.publish(event("progress", "BP-2026-0001"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("observability sink")
    class SinkTests {

        /** Runs tasks on the calling thread. */
        private final class DirectExecutor extends AbstractExecutorService {

            private boolean shutdown;

            @Override
            public void execute(Runnable command) {
                if (shutdown) {
                    throw new java.util.concurrent.RejectedExecutionException("shut down");
                }
                command.run();
            }

            @Override
            public void shutdown() {
                shutdown = true;
            }

            @Override
            public List<Runnable> shutdownNow() {
                shutdown = true;
                return List.of();
            }

            @Override
            public boolean isShutdown() {
                return shutdown;
            }

            @Override
            public boolean isTerminated() {
                return shutdown;
            }

            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) {
                return true;
            }
        }

        @Test
        @DisplayName("publishes emitted events to the bus")
        void publishes() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.all().forSession("BP-2026-0001"), received::add);
            var sink = new EventBusObservabilitySink(eventBus, new DirectExecutor());

            sink.emit(event("progress", "BP-2026-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("drops events after shutdown instead of throwing")
        void dropsAfterShutdown() throws InterruptedException {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.subscribe(EventFilter.all(), received::add);
            var sink = new EventBusObservabilitySink(eventBus, new DirectExecutor());
            sink.shutdown();

            assertDoesNotThrow(() -> sink.emit(event("progress", "BP-2026-0001")));
            assertTrue(received.isEmpty());
        }
    }
}
