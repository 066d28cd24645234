package com.devflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for execution lifecycle events.
 * <p>
 * Supports per-execution subscriptions and global subscriptions that receive all events.
 * Subscribers are invoked on the publishing thread, in subscription order, so output events
 * of one execution are delivered in emission order. A subscriber that throws is logged and
 * does not affect delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-execution subscribers keyed by executionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ExecutionEvent>>> executionSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all executions. */
    private final CopyOnWriteArrayList<Consumer<ExecutionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (execution-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(ExecutionEvent event) {
        if (event.type() != ExecutionEventType.OUTPUT && event.type() != ExecutionEventType.PROGRESS) {
            log.debug("Publishing event: {} for execution {}", event.type(), event.executionId());
        }

        List<Consumer<ExecutionEvent>> subs = executionSubscribers.get(event.executionId());
        if (subs != null) {
            for (Consumer<ExecutionEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ExecutionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific execution.
     *
     * @param executionId the execution to subscribe to
     * @param consumer    callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String executionId, Consumer<ExecutionEvent> consumer) {
        executionSubscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to execution {}", executionId);
        return () -> executionSubscribers.computeIfPresent(executionId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all executions (global subscription).
     *
     * @param consumer callback invoked for each event regardless of execution
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<ExecutionEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of live subscriptions, per-execution and global combined. */
    public int subscriberCount() {
        int count = globalSubscribers.size();
        for (var subs : executionSubscribers.values()) {
            count += subs.size();
        }
        return count;
    }

    /** Number of live subscriptions for one execution. */
    public int subscriberCount(String executionId) {
        var subs = executionSubscribers.get(executionId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ExecutionEvent> subscriber, ExecutionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }
}
