package com.flowkeeper.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static FlowEvent event(String type, String executionId, String nodeId) {
        return new FlowEvent(type, executionId, nodeId, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to execution subscriber")
        void deliversEventToExecutionSubscriber() {
            List<FlowEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-1", received::add);

            var event = event("node.started", "FLOW-1", "greet");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver events of a different execution")
        void doesNotDeliverToDifferentExecution() {
            List<FlowEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-2", received::add);

            eventBus.publish(event("node.started", "FLOW-1", "greet"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void deliversInOrder() {
            List<FlowEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-1", received::add);

            eventBus.publish(event("execution.started", "FLOW-1", null));
            eventBus.publish(event("node.started", "FLOW-1", "a"));
            eventBus.publish(event("node.completed", "FLOW-1", "a"));

            assertEquals(List.of("execution.started", "node.started", "node.completed"),
                    received.stream().map(FlowEvent::eventType).toList());
        }

        @Test
        @DisplayName("emit is publish")
        void emitPublishes() {
            List<FlowEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.emit(event("agent.started", "AG-1", null));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global and execution subscribers both receive the event")
        void globalAndExecutionBothReceive() {
            List<FlowEvent> global = new ArrayList<>();
            List<FlowEvent> scoped = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("FLOW-1", scoped::add);

            eventBus.publish(event("node.started", "FLOW-1", "a"));
            eventBus.publish(event("node.started", "FLOW-2", "a"));

            assertEquals(2, global.size());
            assertEquals(1, scoped.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<FlowEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("FLOW-1", received::add);
            eventBus.publish(event("node.started", "FLOW-1", "a"));

            subscription.unsubscribe();
            eventBus.publish(event("node.completed", "FLOW-1", "a"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing one subscriber does not affect others")
        void unsubscribeDoesNotAffectOthers() {
            List<FlowEvent> first = new ArrayList<>();
            List<FlowEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("FLOW-1", first::add);
            EventBus.Subscription global = eventBus.subscribeAll(second::add);

            subscription.unsubscribe();
            eventBus.publish(event("node.started", "FLOW-1", "a"));
            global.unsubscribe();
            eventBus.publish(event("node.started", "FLOW-1", "b"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<FlowEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("FLOW-1", received::add);

            int threadCount = 10;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event("event." + threadId + "." + i, "FLOW-1", null));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void subscriberExceptionDoesNotPreventOthers() {
            List<FlowEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("FLOW-1", received::add);

            eventBus.publish(event("node.started", "FLOW-1", "a"));

            assertEquals(1, received.size());
        }
    }
}
