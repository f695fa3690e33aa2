package com.flowkeeper.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for execution events.
 * <p>
 * Supports per-execution subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-execution subscribers keyed by executionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FlowEvent>>> executionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<FlowEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    @Override
    public void emit(FlowEvent event) {
        publish(event);
    }

    /**
     * Publish an event to all matching subscribers (execution-specific and global).
     */
    public void publish(FlowEvent event) {
        log.debug("Publishing event: {} for execution {}", event.eventType(), event.executionId());

        List<Consumer<FlowEvent>> subs = executionSubscribers.get(event.executionId());
        if (subs != null) {
            for (Consumer<FlowEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<FlowEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific execution.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String executionId, Consumer<FlowEvent> consumer) {
        executionSubscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to execution {}", executionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<FlowEvent>> subs = executionSubscribers.get(executionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    executionSubscribers.remove(executionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<FlowEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FlowEvent> subscriber, FlowEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
