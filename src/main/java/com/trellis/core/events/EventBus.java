package com.trellis.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for coordination events.
 * <p>
 * Supports per-scope subscriptions (a task id or a thread id) and global subscriptions
 * that receive all events. Events are handed to a single dispatch thread, so publishers
 * never wait on subscriber I/O and subscribers see events in publish order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-scope subscribers keyed by task id or thread id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<CoordinationEvent>>> scopedSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<CoordinationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Executor dispatcher;

    @Autowired
    public EventBus() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-dispatch");
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * @param dispatcher executor that runs deliveries; pass {@code Runnable::run} for
     *                   synchronous delivery on the publishing thread
     */
    public EventBus(Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Publish an event to all matching subscribers (scoped and global).
     *
     * @param event the event to publish
     */
    public void publish(CoordinationEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.scopeId());
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped event {} for {}: dispatcher shut down", event.eventType(), event.scopeId());
        }
    }

    /**
     * Subscribe to events for a specific task or thread.
     *
     * @param scopeId  task id or thread id
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String scopeId, Consumer<CoordinationEvent> consumer) {
        scopedSubscribers.computeIfAbsent(scopeId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", scopeId);
        return () -> {
            CopyOnWriteArrayList<Consumer<CoordinationEvent>> subs = scopedSubscribers.get(scopeId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event (global subscription).
     *
     * @param consumer callback invoked for each event regardless of scope
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<CoordinationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    @PreDestroy
    public void shutdown() {
        if (dispatcher instanceof ExecutorService executor) {
            executor.shutdown();
        }
    }

    private void deliver(CoordinationEvent event) {
        String scopeId = event.scopeId();
        if (scopeId != null) {
            List<Consumer<CoordinationEvent>> scoped = scopedSubscribers.get(scopeId);
            if (scoped != null) {
                for (Consumer<CoordinationEvent> subscriber : scoped) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<CoordinationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void deliverSafely(Consumer<CoordinationEvent> subscriber, CoordinationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
