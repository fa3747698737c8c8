package com.maascheduler.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub bus for scheduler events.
 * <p>
 * Subscribers either follow one task or receive everything. Delivery is synchronous on the
 * publishing thread; a failing subscriber is logged and never affects the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SchedulerEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SchedulerEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SchedulerEvent event) {
        log.debug("Publishing event {} for task {}", event.eventType(), event.taskId());

        if (event.taskId() != null) {
            List<Consumer<SchedulerEvent>> subs = taskSubscribers.get(event.taskId());
            if (subs != null) {
                for (Consumer<SchedulerEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<SchedulerEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public void publish(String eventType, String taskId, Map<String, Object> payload) {
        publish(SchedulerEvent.of(eventType, taskId, payload));
    }

    /**
     * Subscribe to events about one task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<SchedulerEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<SchedulerEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<SchedulerEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SchedulerEvent> subscriber, SchedulerEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
